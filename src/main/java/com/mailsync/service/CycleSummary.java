package com.mailsync.service;

/**
 * Totals of one full sync cycle
 */
public record CycleSummary(int accounts, int synced, int skipped, int failed,
                           int saved, int updated, int errors, long durationMs) {
}
