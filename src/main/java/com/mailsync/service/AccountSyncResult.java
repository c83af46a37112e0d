package com.mailsync.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregated outcome of syncing one account
 */
@Value
@Builder
public class AccountSyncResult {

    public enum Outcome {
        SYNCED,
        SKIPPED,
        THROTTLED,
        NEEDS_RECONNECTION,
        FAILED
    }

    long accountId;
    Outcome outcome;
    String message;
    @Singular
    List<FolderSyncResult> folders;

    public int getFetched() {
        return folders.stream().mapToInt(FolderSyncResult::getFetched).sum();
    }

    public int getSaved() {
        return folders.stream().mapToInt(FolderSyncResult::getSaved).sum();
    }

    public int getUpdated() {
        return folders.stream().mapToInt(FolderSyncResult::getUpdated).sum();
    }

    public int getErrors() {
        return folders.stream().mapToInt(FolderSyncResult::getErrors).sum();
    }

    public static AccountSyncResult skipped(long accountId, String reason) {
        return AccountSyncResult.builder().accountId(accountId).outcome(Outcome.SKIPPED).message(reason).build();
    }
}
