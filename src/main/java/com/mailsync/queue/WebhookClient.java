package com.mailsync.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs notification JSON to the webhook endpoint
 */
@Slf4j
@Component
public class WebhookClient {

    private final RestTemplate restTemplate;

    public WebhookClient(@Qualifier("webhookRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * @return HTTP status code
     * @throws org.springframework.web.client.RestClientException on transport failure or non-2xx status
     */
    public int post(String url, String payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
        log.debug("Webhook {} answered {}", url, response.getStatusCode().value());
        return response.getStatusCode().value();
    }
}
