package com.mailsync.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watcher sessions by account
 * - MONITORING: watcher registered but polling only, sync still runs
 * - IDLING: IMAP IDLE holds the connection slot, sync skips the account
 */
@Slf4j
@Component
public class RealtimeSessionRegistry implements RealtimeCoordinator {

    public enum SessionMode {
        MONITORING,
        IDLING
    }

    private final Map<Long, SessionMode> sessions = new ConcurrentHashMap<>();

    public void register(long accountId, SessionMode mode) {
        SessionMode previous = sessions.put(accountId, mode);
        if (previous != mode) {
            log.info("Realtime session for account {}: {} -> {}", accountId, previous, mode);
        }
    }

    public void unregister(long accountId) {
        if (sessions.remove(accountId) != null) {
            log.info("Realtime session for account {} ended", accountId);
        }
    }

    public SessionMode mode(long accountId) {
        return sessions.get(accountId);
    }

    public int activeCount() {
        return (int) sessions.values().stream().filter(mode -> mode == SessionMode.IDLING).count();
    }

    @Override
    public boolean isRealtimeActive(long accountId) {
        return sessions.get(accountId) == SessionMode.IDLING;
    }
}
