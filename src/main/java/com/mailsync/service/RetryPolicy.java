package com.mailsync.service;

import com.mailsync.config.SyncProperties;

/**
 * Bounded exponential backoff: delay = min(base * 2^attempt, max)
 */
public record RetryPolicy(String operationName, int maxRetries, long baseDelayMs, long maxDelayMs) {

    public static RetryPolicy of(String operationName, SyncProperties.Retry retry) {
        return new RetryPolicy(operationName, retry.getMaxRetries(), retry.getBaseDelayMs(), retry.getMaxDelayMs());
    }

    public long delayFor(int attempt) {
        if (attempt >= 62) {
            return maxDelayMs;
        }
        long delay = baseDelayMs * (1L << attempt);
        return delay < 0 ? maxDelayMs : Math.min(delay, maxDelayMs);
    }
}
