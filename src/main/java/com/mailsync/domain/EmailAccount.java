package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Remote mailbox account entity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailAccount {

    private Long id;
    private String userId;
    private String email;
    private String imapHost;
    private Integer imapPort;
    private String imapUsername;
    private String imapPassword;            // AES-256-CBC "iv:cipher" or plain text
    private int useSsl;
    private int active;
    private SyncStatus syncStatus;
    private String syncErrorDetails;
    private String lastError;
    private int needsReconnection;
    private int initialSyncCompleted;
    private String webhookEnabledAt;        // ISO-8601, set once with initialSyncCompleted
    private String lastSuccessfulSyncAt;
    private String lastSyncAttemptAt;
    private String lastConnectionAttempt;
    private String createdAt;

    /**
     * Host and username are required to open an IMAP session
     */
    public boolean hasImapSettings() {
        return imapHost != null && !imapHost.isBlank()
                && imapUsername != null && !imapUsername.isBlank();
    }
}
