package com.mailsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * MailSync configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "mailsync")
public class SyncProperties {

    private Scheduler scheduler = new Scheduler();
    private Sync sync = new Sync();
    private Pool pool = new Pool();
    private Transport transport = new Transport();
    private Errors errors = new Errors();
    private Security security = new Security();
    private Notification notification = new Notification();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long initialDelayMs = 30000L;
        private long intervalMs = 600000L; // every 10 minutes
    }

    @Data
    public static class Sync {
        private int batchSize = 50;
        private long batchDelayMs = 1000L;
        private long throttlePauseMs = 5000L;
        private String defaultFolder = "INBOX";
        private int subjectMaxLength = 255;
        private int errorDetailMaxLength = 500;
        private Retry folderOpen = new Retry(3, 2000L, 30000L);
        private Retry enumerate = new Retry(5, 3000L, 60000L);
    }

    @Data
    public static class Retry {
        private int maxRetries;
        private long baseDelayMs;
        private long maxDelayMs;

        public Retry() {
            this(3, 2000L, 30000L);
        }

        public Retry(int maxRetries, long baseDelayMs, long maxDelayMs) {
            this.maxRetries = maxRetries;
            this.baseDelayMs = baseDelayMs;
            this.maxDelayMs = maxDelayMs;
        }
    }

    @Data
    public static class Pool {
        private long maxConnectionAgeMs = 1800000L; // 30 minutes
    }

    @Data
    public static class Transport {
        private long connectTimeoutMs = 10000L;
        private long readTimeoutMs = 30000L;
        private boolean trustAllCertificates = false;
    }

    /**
     * Provider error signatures, matched case-insensitively against
     * transport error messages and codes.
     */
    @Data
    public static class Errors {
        private List<String> throttle = new ArrayList<>(List.of(
                "[THROTTLED]", "throttled", "rate limit", "rate_limit", "too many requests",
                "quota exceeded", "quota_exceeded", "system error", "temporary failure",
                "temporary_failure", "try again", "try_again"));
        private List<String> authentication = new ArrayList<>(List.of(
                "not authenticated", "not_authenticated", "authentication failed", "auth failed",
                "invalid credentials", "login failed", "session expired"));
        private List<String> notFound = new ArrayList<>(List.of(
                "unknown mailbox", "nonexistent", "does not exist", "no such mailbox", "folder not found"));
        private List<String> connectionDropped = new ArrayList<>(List.of(
                "ended unexpectedly", "connection closed", "connection reset", "connection lost",
                "econnreset", "socket closed", "broken pipe"));
        private List<String> throttleCodes = new ArrayList<>(List.of("THROTTLED", "LIMIT"));
        private List<String> authenticationCodes = new ArrayList<>(List.of(
                "AUTHENTICATIONFAILED", "AUTHORIZATIONFAILED", "NOT_AUTHENTICATED"));
        private List<String> notFoundCodes = new ArrayList<>(List.of("NONEXISTENT"));
        private List<String> connectionDroppedCodes = new ArrayList<>(List.of("CLOSED", "BYE"));
    }

    @Data
    public static class Security {
        private String encryptionKey = ""; // 64 hex chars (AES-256); blank = plain text passwords
    }

    @Data
    public static class Notification {
        private boolean enabled = true;
        private String webhookUrl = "";
        private String destination = "mailsync.notification.queue";
        private long timeoutMs = 10000L;
        private int retryMaxAttempts = 5;
        private long retryInitialDelayMs = 30000L;
        private long retryMaxDelayMs = 3600000L;
    }
}
