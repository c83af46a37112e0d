package com.mailsync.queue;

import com.mailsync.config.SyncProperties;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.TextMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * ActiveMQ notification queue consumer
 * - Delivers each event to the webhook URL
 * - Exponential-backoff retry through the broker scheduler, then drop
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationQueueConsumer {

    private final WebhookClient webhookClient;
    private final NotificationQueueProducer queueProducer;
    private final SyncProperties properties;

    @JmsListener(destination = "${mailsync.notification.destination:mailsync.notification.queue}")
    public void process(Message message) {
        if (!(message instanceof TextMessage textMessage)) {
            log.warn("Unexpected message type in notification queue: {}", message.getClass().getSimpleName());
            return;
        }

        String payload;
        long accountId;
        int attemptCount;
        try {
            payload = textMessage.getText();
            accountId = textMessage.getLongProperty(NotificationQueueProducer.ACCOUNT_ID);
            attemptCount = textMessage.getIntProperty(NotificationQueueProducer.ATTEMPT_COUNT);
        } catch (JMSException e) {
            log.error("Unreadable notification message dropped", e);
            return;
        }

        String url = properties.getNotification().getWebhookUrl();
        try {
            int status = webhookClient.post(url, payload);
            log.info("Webhook delivered for account {} (status {}, attempt {})", accountId, status, attemptCount);
        } catch (RestClientException e) {
            if (attemptCount < properties.getNotification().getRetryMaxAttempts()) {
                long backoff = calculateBackoff(attemptCount);
                queueProducer.enqueueRetry(payload, accountId, attemptCount + 1, backoff);
                log.warn("Webhook failed for account {}, will retry in {}ms (attempt {}): {}",
                        accountId, backoff, attemptCount + 1, e.getMessage());
            } else {
                log.error("Max retry attempts reached for account {} webhook, notification dropped: {}",
                        accountId, e.getMessage());
            }
        }
    }

    /**
     * min(initial * 2^attempt + jitter, max)
     */
    long calculateBackoff(int attempt) {
        long baseDelay = properties.getNotification().getRetryInitialDelayMs();
        long maxDelay = properties.getNotification().getRetryMaxDelayMs();
        long delay = (long) (baseDelay * Math.pow(2, attempt));
        long jitter = (long) (Math.random() * 1000);
        return Math.min(delay + jitter, maxDelay);
    }
}
