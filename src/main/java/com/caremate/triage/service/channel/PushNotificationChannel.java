package com.caremate.triage.service.channel;

import com.caremate.triage.exception.NotificationDeliveryException;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts alerts to the hospital's mobile push gateway.
 */
@Component
public class PushNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationChannel.class);

    private final RestTemplate restTemplate;
    private final String gatewayUrl;
    private final String apiKey;

    public PushNotificationChannel(
            RestTemplateBuilder builder,
            @Value("${caremate.push.gateway-url:}") String gatewayUrl,
            @Value("${caremate.push.api-key:}") String apiKey,
            @Value("${caremate.push.timeout-ms:3000}") long timeoutMs) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.gatewayUrl = gatewayUrl;
        this.apiKey = apiKey;
    }

    @Override
    public NotificationChannelType type() {
        return NotificationChannelType.PUSH;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.isNotBlank(gatewayUrl);
    }

    @Override
    public void deliver(String recipientId, String message, UrgencyLevel priority) {
        if (!isConfigured()) {
            throw new NotificationDeliveryException(type(), recipientId, "push gateway url not set");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiKey)) {
            headers.setBearerAuth(apiKey);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipientId", recipientId);
        body.put("priority", priority.name());
        body.put("title", priority == UrgencyLevel.CRITICAL ? "CRITICAL patient alert" : "Patient alert");
        body.put("body", message);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(gatewayUrl, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new NotificationDeliveryException(type(), recipientId,
                        "gateway returned " + response.getStatusCode());
            }
            log.debug("Push sent to {} ({})", recipientId, priority);
        } catch (RestClientException e) {
            throw new NotificationDeliveryException(type(), recipientId, e);
        }
    }
}
