package com.mailsync.service;

import com.mailsync.error.AuthenticationException;
import com.mailsync.error.ErrorClassifier;
import com.mailsync.error.ErrorKind;
import com.mailsync.error.FolderNotFoundException;
import com.mailsync.error.MailSyncException;
import com.mailsync.error.ThrottledException;
import com.mailsync.error.TransientConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Error-class-aware retry for folder open and enumeration
 * - Not found: fail immediately
 * - Authentication: reconnect once, then retry
 * - Throttling: exponential backoff, ThrottledException when exhausted
 * - Dropped connection: repair, backoff, TransientConnectionException when exhausted
 * - Anything else: backoff, then rethrown as-is
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryExecutor {

    private final ErrorClassifier errorClassifier;
    private final ConnectionManager connectionManager;
    private final Sleeper sleeper;

    public <T> T execute(RetryPolicy policy, ConnectionLease lease, String folderName, ConnectionOperation<T> operation) {
        int attempt = 0;
        boolean reconnected = false;
        while (true) {
            try {
                return operation.apply(lease.connection());
            } catch (Exception e) {
                ErrorKind kind = errorClassifier.classify(e);
                switch (kind) {
                    case NOT_FOUND -> throw new FolderNotFoundException(folderName, e);
                    case AUTHENTICATION -> {
                        if (reconnected) {
                            throw new AuthenticationException(
                                    policy.operationName() + " still not authenticated after reconnect: " + e.getMessage(), e);
                        }
                        log.warn("{}: authentication lost for account {}, reconnecting", policy.operationName(), lease.accountId());
                        reconnectForRetry(lease, e);
                        reconnected = true;
                        continue;
                    }
                    default -> {
                        // handled below
                    }
                }

                if (attempt >= policy.maxRetries()) {
                    throw exhausted(policy, kind, e);
                }
                long delay = policy.delayFor(attempt);
                attempt++;
                log.warn("{} failed [{}] (attempt {}/{}), retrying in {}ms: {}",
                        policy.operationName(), kind, attempt, policy.maxRetries(), delay, e.getMessage());
                sleeper.sleep(delay);
                if (kind == ErrorKind.CONNECTION_DROPPED) {
                    connectionManager.ensureHealthy(lease);
                }
            }
        }
    }

    private void reconnectForRetry(ConnectionLease lease, Exception original) {
        try {
            connectionManager.reconnect(lease);
        } catch (MailSyncException e) {
            String message = "Reconnect after authentication failure failed: " + e.getMessage();
            throw switch (e.getKind()) {
                case THROTTLED -> new ThrottledException(message, e);
                case CONNECTION_DROPPED -> new TransientConnectionException(message, e);
                case AUTHENTICATION -> new AuthenticationException(message, original);
                default -> e;
            };
        }
    }

    private RuntimeException exhausted(RetryPolicy policy, ErrorKind kind, Exception e) {
        String message = policy.operationName() + " failed after " + policy.maxRetries() + " retries: " + e.getMessage();
        log.error(message);
        return switch (kind) {
            case THROTTLED -> new ThrottledException(message, e);
            case CONNECTION_DROPPED -> new TransientConnectionException(message, e);
            default -> e instanceof RuntimeException runtime ? runtime : new MailSyncException(kind, message, e);
        };
    }
}
