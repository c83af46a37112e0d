package com.mailsync.domain;

/**
 * Account sync status persisted after every cycle outcome
 */
public enum SyncStatus {
    IDLE,
    SYNCING,
    ERROR,
    THROTTLED
}
