package com.mailsync.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used for webhook delivery
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final SyncProperties properties;

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder) {
        Duration timeout = Duration.ofMillis(properties.getNotification().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
