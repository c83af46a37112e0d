package com.mailsync.service;

/**
 * Shared signal between polling sync and the real-time watcher.
 * Polling must not touch an account while its watcher session is active.
 */
public interface RealtimeCoordinator {

    boolean isRealtimeActive(long accountId);
}
