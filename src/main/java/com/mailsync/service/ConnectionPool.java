package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.EmailAccount;
import com.mailsync.transport.MailConnection;
import com.mailsync.transport.MailTransport;
import com.mailsync.transport.SessionState;
import com.mailsync.transport.TransportException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared IMAP connection pool
 * - At most one connection per account
 * - Connections older than mailsync.pool.max-connection-age-ms or logged out are evicted on lease
 * - Per-account health state for the lifecycle manager and the status endpoint
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionPool {

    private final MailTransport transport;
    private final SyncProperties properties;

    private final Map<Long, PooledConnection> connections = new ConcurrentHashMap<>();
    private final Map<Long, ConnectionHealth> health = new ConcurrentHashMap<>();

    private record PooledConnection(MailConnection connection, long createdAt) {
    }

    /**
     * Lease the account's pooled connection; the lease holds no connection when none is pooled
     */
    public ConnectionLease lease(EmailAccount account) {
        long accountId = account.getId();
        PooledConnection pooled = connections.get(accountId);
        if (pooled != null && isExpired(pooled)) {
            log.debug("Evicting stale connection for account {}", accountId);
            evict(accountId);
            pooled = null;
        }
        return new ConnectionLease(account, pooled != null ? pooled.connection() : null);
    }

    /**
     * Open a fresh connection for the lease's account and make it the pooled one
     */
    public MailConnection open(ConnectionLease lease) throws TransportException {
        long accountId = lease.accountId();
        health.put(accountId, ConnectionHealth.CONNECTING);
        MailConnection connection;
        try {
            connection = transport.connect(lease.account());
        } catch (TransportException | RuntimeException e) {
            health.put(accountId, ConnectionHealth.UNHEALTHY);
            throw e;
        }
        PooledConnection previous = connections.put(accountId, new PooledConnection(connection, System.currentTimeMillis()));
        if (previous != null && previous.connection() != connection) {
            closeQuietly(accountId, previous.connection());
        }
        lease.swap(connection);
        log.info("IMAP connection opened for account {}", accountId);
        return connection;
    }

    /**
     * Close the pooled connection and open a new one
     */
    public MailConnection replace(ConnectionLease lease) throws TransportException {
        evict(lease.accountId());
        lease.swap(null);
        return open(lease);
    }

    /**
     * Hand the lease back. Disposed connections are closed and removed from the pool.
     */
    public void release(ConnectionLease lease, boolean dispose) {
        if (dispose) {
            evict(lease.accountId());
            lease.swap(null);
        }
    }

    public void evict(long accountId) {
        PooledConnection pooled = connections.remove(accountId);
        health.put(accountId, ConnectionHealth.ABSENT);
        if (pooled != null) {
            closeQuietly(accountId, pooled.connection());
        }
    }

    public void markHealth(long accountId, ConnectionHealth state) {
        health.put(accountId, state);
    }

    public ConnectionHealth health(long accountId) {
        return health.getOrDefault(accountId, ConnectionHealth.ABSENT);
    }

    public PoolStats stats() {
        long healthy = health.values().stream().filter(h -> h == ConnectionHealth.HEALTHY).count();
        long unhealthy = health.values().stream().filter(h -> h == ConnectionHealth.UNHEALTHY).count();
        long connecting = health.values().stream().filter(h -> h == ConnectionHealth.CONNECTING).count();
        return new PoolStats(connections.size(), healthy, unhealthy, connecting);
    }

    @PreDestroy
    public void closeAll() {
        List<Long> accountIds = new ArrayList<>(connections.keySet());
        for (Long accountId : accountIds) {
            evict(accountId);
        }
        log.info("Connection pool closed ({} connections)", accountIds.size());
    }

    private boolean isExpired(PooledConnection pooled) {
        long age = System.currentTimeMillis() - pooled.createdAt();
        return age > properties.getPool().getMaxConnectionAgeMs()
                || pooled.connection().sessionState() == SessionState.LOGGED_OUT;
    }

    private void closeQuietly(long accountId, MailConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connection for account {}: {}", accountId, e.getMessage());
        }
    }
}
