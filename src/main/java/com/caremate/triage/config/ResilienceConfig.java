package com.caremate.triage.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public Retry notificationRetry(
            @Value("${caremate.notification.max-attempts:3}") int maxAttempts,
            @Value("${caremate.notification.initial-backoff-ms:200}") long initialBackoffMs) {
        return exponential("notification", maxAttempts, initialBackoffMs);
    }

    @Bean
    public Retry auditRetry(
            @Value("${caremate.audit.max-attempts:5}") int maxAttempts,
            @Value("${caremate.audit.initial-backoff-ms:100}") long initialBackoffMs) {
        return exponential("audit", maxAttempts, initialBackoffMs);
    }

    public static Retry exponential(String name, int maxAttempts, long initialBackoffMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), 2.0))
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("{} retry #{} after {}: {}", name, event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(), String.valueOf(event.getLastThrowable())));
        return retry;
    }
}
