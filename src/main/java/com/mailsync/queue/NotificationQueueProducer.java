package com.mailsync.queue;

import com.mailsync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.activemq.ScheduledMessage;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;

/**
 * ActiveMQ notification queue producer
 * - JSON text messages with an attemptCount property
 * - Retries are delayed through the broker scheduler
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationQueueProducer {

    static final String ATTEMPT_COUNT = "attemptCount";
    static final String ACCOUNT_ID = "accountId";

    private final JmsTemplate jmsTemplate;
    private final SyncProperties properties;

    public void enqueue(String payload, long accountId) {
        send(payload, accountId, 0, 0L);
        log.debug("Notification enqueued for account {}", accountId);
    }

    /**
     * Re-enqueue a failed notification after delayMs
     */
    public void enqueueRetry(String payload, long accountId, int attemptCount, long delayMs) {
        send(payload, accountId, attemptCount, delayMs);
        log.info("Notification re-enqueued for account {} (attempt {}, delay {}ms)", accountId, attemptCount, delayMs);
    }

    private void send(String payload, long accountId, int attemptCount, long delayMs) {
        jmsTemplate.send(properties.getNotification().getDestination(), session -> {
            var message = session.createTextMessage(payload);
            message.setLongProperty(ACCOUNT_ID, accountId);
            message.setIntProperty(ATTEMPT_COUNT, attemptCount);
            if (delayMs > 0) {
                message.setLongProperty(ScheduledMessage.AMQ_SCHEDULED_DELAY, delayMs);
            }
            return message;
        });
    }
}
