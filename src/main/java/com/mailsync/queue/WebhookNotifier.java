package com.mailsync.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailsync.config.SyncProperties;
import com.mailsync.domain.AttachmentMeta;
import com.mailsync.domain.EmailAccount;
import com.mailsync.domain.MailRecord;
import com.mailsync.mapper.EmailAccountMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Webhook notification for newly stored messages
 * - Sent only after the account's initial sync, for mail received after webhook_enabled_at
 * - Accepted events go to the ActiveMQ notification queue; delivery happens in {@link NotificationQueueConsumer}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotifier implements MailNotifier {

    private static final TypeReference<List<AttachmentMeta>> ATTACHMENTS = new TypeReference<>() {};

    private final EmailAccountMapper accountMapper;
    private final NotificationQueueProducer queueProducer;
    private final ObjectMapper objectMapper;
    private final SyncProperties properties;

    /**
     * Gate checks return a skip reason; a failure to enqueue is thrown
     */
    @Override
    public NotifyResult notify(MailRecord record, long accountId, String userId) {
        SyncProperties.Notification config = properties.getNotification();
        if (!config.isEnabled()) {
            return NotifyResult.skipped("notifications_disabled");
        }
        if (config.getWebhookUrl() == null || config.getWebhookUrl().isBlank()) {
            return NotifyResult.skipped("no_webhook_url");
        }
        if (userId == null || userId.isBlank()) {
            log.warn("No user id for account {}, skipping webhook", accountId);
            return NotifyResult.skipped("missing_user_id");
        }

        EmailAccount account;
        try {
            account = accountMapper.findById(accountId);
        } catch (RuntimeException e) {
            log.error("Cannot verify sync state of account {}, skipping webhook: {}", accountId, e.getMessage());
            return NotifyResult.skipped("database_error");
        }
        if (account == null) {
            return NotifyResult.skipped("account_not_found");
        }
        if (account.getInitialSyncCompleted() != 1) {
            log.debug("Skipping webhook for UID {}: initial sync not completed", record.getUid());
            return NotifyResult.skipped("initial_sync_not_completed");
        }
        if (account.getWebhookEnabledAt() == null) {
            log.warn("Account {} completed initial sync but has no webhook_enabled_at, skipping webhook", accountId);
            return NotifyResult.skipped("webhook_enabled_at_missing");
        }
        if (record.getReceivedAt() == null) {
            return NotifyResult.skipped("missing_email_date");
        }

        Instant enabledAt;
        Instant receivedAt;
        try {
            enabledAt = Instant.parse(account.getWebhookEnabledAt());
            receivedAt = Instant.parse(record.getReceivedAt());
        } catch (DateTimeParseException e) {
            log.error("Invalid date on account {} or UID {}: {}", accountId, record.getUid(), e.getMessage());
            return NotifyResult.skipped("invalid_date_format");
        }
        if (receivedAt.isBefore(enabledAt)) {
            log.debug("Skipping webhook for UID {}: received {} before webhooks enabled {}", record.getUid(), receivedAt, enabledAt);
            return NotifyResult.skipped("email_older_than_webhook_enable");
        }

        queueProducer.enqueue(toPayload(record, accountId, userId), accountId);
        return NotifyResult.queued();
    }

    String toPayload(MailRecord record, long accountId, String userId) {
        NotificationEvent event = NotificationEvent.builder()
                .event(NotificationEvent.NEW_EMAIL)
                .timestamp(Instant.now().toString())
                .accountId(accountId)
                .userId(userId)
                .email(NotificationEvent.Email.builder()
                        .id(record.getId())
                        .uid(record.getUid())
                        .subject(record.getSubject())
                        .senderName(nullToEmpty(record.getSenderName()))
                        .senderEmail(nullToEmpty(record.getSenderEmail()))
                        .recipientEmail(nullToEmpty(record.getRecipientEmail()))
                        .bodyText(nullToEmpty(record.getBodyText()))
                        .bodyHtml(nullToEmpty(record.getBodyHtml()))
                        .receivedAt(record.getReceivedAt())
                        .folderName(record.getFolderName())
                        .read(record.getIsRead() == 1)
                        .starred(record.getIsStarred() == 1)
                        .attachmentsCount(record.getAttachmentsCount())
                        .attachmentsMeta(attachments(record.getAttachmentsMeta()))
                        .build())
                .build();
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification for " + record.getProviderMessageId(), e);
        }
    }

    private List<AttachmentMeta> attachments(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, ATTACHMENTS);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable attachment metadata, sending none: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
