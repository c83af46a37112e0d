package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical synchronized message.
 * Unique by (accountId, providerMessageId).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailRecord {

    private Long id;
    private long accountId;
    private String providerMessageId;   // accountId_uid_folder
    private long uid;
    private String folderName;
    private String senderName;
    private String senderEmail;
    private String recipientEmail;
    private String subject;
    private String bodyText;
    private String bodyHtml;
    private String receivedAt;          // ISO-8601
    private int isRead;
    private int isStarred;
    private int isDeleted;
    private String attachmentsMeta;     // JSON array
    private int attachmentsCount;

    /**
     * Idempotency key of a message observed in a folder
     */
    public static String providerMessageId(long accountId, long uid, String folderName) {
        return accountId + "_" + uid + "_" + folderName;
    }
}
