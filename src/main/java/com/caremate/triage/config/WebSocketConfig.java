package com.caremate.triage.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.caremate.triage.websocket.StaffDashboardHandler;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final StaffDashboardHandler staffDashboardHandler;

    public WebSocketConfig(StaffDashboardHandler staffDashboardHandler) {
        this.staffDashboardHandler = staffDashboardHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(staffDashboardHandler, "/ws/staff-dashboard")
                .setAllowedOrigins("*");
    }
}
