package com.mailsync.service;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one folder sync attempt. Never thrown; failures are flags on the result.
 */
@Value
@Builder(toBuilder = true)
public class FolderSyncResult {

    String folderName;
    int fetched;
    int saved;
    int updated;
    int errors;
    int notificationFailures;
    long durationMs;
    boolean throttled;
    boolean authFailed;
    boolean notFound;
    String error;

    public boolean isFailed() {
        return authFailed || error != null && !throttled;
    }
}
