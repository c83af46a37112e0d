package com.mailsync.service;

import com.mailsync.error.ConnectionException;
import com.mailsync.error.ErrorClassifier;
import com.mailsync.error.ErrorKind;
import com.mailsync.transport.MailConnection;
import com.mailsync.transport.SessionState;
import com.mailsync.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Connection lifecycle: obtain, health-check and repair the account's pooled connection.
 * A connection is healthy only when authenticated and a NOOP round trip succeeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionManager {

    private final ConnectionPool pool;
    private final ErrorClassifier errorClassifier;

    /**
     * Return a healthy connection for the lease, replacing the pooled one once if needed
     *
     * @throws ConnectionException when a fresh connection cannot be established or is still unhealthy
     */
    public MailConnection ensureHealthy(ConnectionLease lease) {
        MailConnection connection = lease.connection();
        if (connection == null) {
            connection = openFresh(lease);
            return verifyFresh(lease, connection);
        }

        TransportException failure = probe(connection);
        if (failure == null) {
            pool.markHealth(lease.accountId(), ConnectionHealth.HEALTHY);
            return connection;
        }

        pool.markHealth(lease.accountId(), ConnectionHealth.UNHEALTHY);
        log.warn("Pooled connection for account {} is unhealthy ({}), reconnecting",
                lease.accountId(), failure.getMessage());
        return reconnect(lease);
    }

    /**
     * Dispose the current connection and establish a verified new one
     */
    public MailConnection reconnect(ConnectionLease lease) {
        MailConnection fresh;
        try {
            fresh = pool.replace(lease);
        } catch (TransportException e) {
            throw connectionFailure(lease, "Reconnect failed", e);
        }
        return verifyFresh(lease, fresh);
    }

    public boolean isHealthy(MailConnection connection) {
        return probe(connection) == null;
    }

    private MailConnection openFresh(ConnectionLease lease) {
        try {
            return pool.open(lease);
        } catch (TransportException e) {
            throw connectionFailure(lease, "Connect failed", e);
        }
    }

    private MailConnection verifyFresh(ConnectionLease lease, MailConnection connection) {
        TransportException failure = probe(connection);
        if (failure != null) {
            pool.markHealth(lease.accountId(), ConnectionHealth.UNHEALTHY);
            throw connectionFailure(lease, "Fresh connection is unhealthy", failure);
        }
        pool.markHealth(lease.accountId(), ConnectionHealth.HEALTHY);
        return connection;
    }

    /**
     * @return null when healthy, otherwise the failure that made it unhealthy
     */
    private TransportException probe(MailConnection connection) {
        SessionState state = connection.sessionState();
        if (state != SessionState.AUTHENTICATED) {
            return new TransportException("Connection state is " + state + ", not authenticated", "NOT_AUTHENTICATED");
        }
        try {
            connection.probe();
            return null;
        } catch (TransportException e) {
            return e;
        } catch (RuntimeException e) {
            return new TransportException(e.getMessage(), null, e);
        }
    }

    private ConnectionException connectionFailure(ConnectionLease lease, String what, TransportException cause) {
        ErrorKind kind = errorClassifier.classify(cause);
        log.error("{} for account {} [{}]: {}", what, lease.accountId(), kind, cause.getMessage());
        return new ConnectionException(kind, what + ": " + cause.getMessage(), cause);
    }
}
