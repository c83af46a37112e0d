package com.mailsync.queue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mailsync.domain.AttachmentMeta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * "new_email" webhook payload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationEvent {

    public static final String NEW_EMAIL = "new_email";

    @JsonProperty("event")
    private String event;
    @JsonProperty("timestamp")
    private String timestamp;
    @JsonProperty("account_id")
    private long accountId;
    @JsonProperty("user_id")
    private String userId;
    @JsonProperty("email")
    private Email email;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Email {
        @JsonProperty("id")
        private Long id;
        @JsonProperty("uid")
        private long uid;
        @JsonProperty("subject")
        private String subject;
        @JsonProperty("sender_name")
        private String senderName;
        @JsonProperty("sender_email")
        private String senderEmail;
        @JsonProperty("recipient_email")
        private String recipientEmail;
        @JsonProperty("body_text")
        private String bodyText;
        @JsonProperty("body_html")
        private String bodyHtml;
        @JsonProperty("received_at")
        private String receivedAt;
        @JsonProperty("folder_name")
        private String folderName;
        @JsonProperty("is_read")
        private boolean read;
        @JsonProperty("is_starred")
        private boolean starred;
        @JsonProperty("attachments_count")
        private int attachmentsCount;
        @JsonProperty("attachments_meta")
        private List<AttachmentMeta> attachmentsMeta;
    }
}
