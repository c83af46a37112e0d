package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.EmailAccount;
import com.mailsync.error.AuthenticationException;
import com.mailsync.error.ConnectionException;
import com.mailsync.error.ErrorClassifier;
import com.mailsync.error.ErrorKind;
import com.mailsync.error.FolderNotFoundException;
import com.mailsync.error.ThrottledException;
import com.mailsync.error.TransientConnectionException;
import com.mailsync.transport.FolderInfo;
import com.mailsync.transport.MailConnection;
import com.mailsync.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * RetryExecutor unit tests
 */
@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    @Mock
    private ConnectionManager connectionManager;

    @Mock
    private Sleeper sleeper;

    @Mock
    private MailConnection connection;

    private RetryExecutor executor;
    private ConnectionLease lease;
    private final RetryPolicy policy = new RetryPolicy("Opening folder INBOX", 3, 2000L, 30000L);
    private final FolderInfo inbox = new FolderInfo("INBOX", 10, 1L);

    @BeforeEach
    void setUp() {
        executor = new RetryExecutor(new ErrorClassifier(new SyncProperties()), connectionManager, sleeper);
        lease = new ConnectionLease(EmailAccount.builder().id(1L).build(), connection);
    }

    private FolderInfo open() {
        return executor.execute(policy, lease, "INBOX", c -> c.openFolder("INBOX"));
    }

    @Test
    @DisplayName("Delay doubles per attempt and is capped")
    void testPolicyDelays() {
        assertThat(policy.delayFor(0)).isEqualTo(2000L);
        assertThat(policy.delayFor(1)).isEqualTo(4000L);
        assertThat(policy.delayFor(3)).isEqualTo(16000L);
        assertThat(policy.delayFor(4)).isEqualTo(30000L);
        assertThat(policy.delayFor(100)).isEqualTo(30000L);
    }

    @Test
    @DisplayName("Success on first attempt does not sleep")
    void testFirstAttempt() throws Exception {
        when(connection.openFolder("INBOX")).thenReturn(inbox);

        assertThat(open()).isEqualTo(inbox);
        verifyNoInteractions(sleeper, connectionManager);
    }

    @Test
    @DisplayName("Throttle is retried with exponential backoff")
    void testThrottleRecovers() throws Exception {
        when(connection.openFolder("INBOX"))
                .thenThrow(new TransportException("[THROTTLED] slow down", null))
                .thenThrow(new TransportException("[THROTTLED] slow down", null))
                .thenReturn(inbox);

        assertThat(open()).isEqualTo(inbox);

        InOrder order = inOrder(sleeper);
        order.verify(sleeper).sleep(2000L);
        order.verify(sleeper).sleep(4000L);
        verify(connectionManager, never()).ensureHealthy(lease);
    }

    @Test
    @DisplayName("Persistent throttle becomes ThrottledException after max retries")
    void testThrottleExhausted() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Too many requests", null));

        assertThatThrownBy(this::open).isInstanceOf(ThrottledException.class);
        verify(connection, times(4)).openFolder("INBOX");
        verify(sleeper, times(3)).sleep(anyLong());
    }

    @Test
    @DisplayName("Missing folder fails without retry")
    void testNotFound() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Unknown Mailbox: INBOX", "NONEXISTENT"));

        assertThatThrownBy(this::open).isInstanceOf(FolderNotFoundException.class);
        verify(connection, times(1)).openFolder("INBOX");
        verifyNoInteractions(sleeper);
    }

    @Test
    @DisplayName("Dropped connection is repaired before the next attempt")
    void testConnectionDroppedRepaired() throws Exception {
        MailConnection fresh = mock(MailConnection.class);
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Connection closed", "CLOSED"));
        when(fresh.openFolder("INBOX")).thenReturn(inbox);
        when(connectionManager.ensureHealthy(lease)).thenAnswer(invocation -> {
            lease.swap(fresh);
            return fresh;
        });

        assertThat(open()).isEqualTo(inbox);
        verify(sleeper).sleep(2000L);
    }

    @Test
    @DisplayName("Persistent dropped connection becomes TransientConnectionException")
    void testConnectionDroppedExhausted() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Connection reset by peer", null));
        when(connectionManager.ensureHealthy(lease)).thenReturn(connection);

        assertThatThrownBy(this::open).isInstanceOf(TransientConnectionException.class);
        verify(connectionManager, times(3)).ensureHealthy(lease);
    }

    @Test
    @DisplayName("Authentication loss reconnects once without consuming an attempt")
    void testAuthenticationReconnect() throws Exception {
        when(connection.openFolder("INBOX"))
                .thenThrow(new TransportException("Not authenticated", "NOT_AUTHENTICATED"))
                .thenReturn(inbox);
        when(connectionManager.reconnect(lease)).thenReturn(connection);

        assertThat(open()).isEqualTo(inbox);
        verify(connectionManager).reconnect(lease);
        verifyNoInteractions(sleeper);
    }

    @Test
    @DisplayName("Second authentication failure is fatal")
    void testAuthenticationTwice() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Invalid credentials", "AUTHENTICATIONFAILED"));
        when(connectionManager.reconnect(lease)).thenReturn(connection);

        assertThatThrownBy(this::open).isInstanceOf(AuthenticationException.class);
        verify(connectionManager, times(1)).reconnect(lease);
    }

    @Test
    @DisplayName("Failed reconnect after authentication loss is an authentication failure")
    void testAuthenticationReconnectFails() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Session expired", null));
        when(connectionManager.reconnect(lease))
                .thenThrow(new ConnectionException(ErrorKind.AUTHENTICATION, "login failed", null));

        assertThatThrownBy(this::open).isInstanceOf(AuthenticationException.class);
    }

    @Test
    @DisplayName("Throttled reconnect after authentication loss stays a throttle")
    void testAuthenticationReconnectThrottled() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Not authenticated", "NOT_AUTHENTICATED"));
        when(connectionManager.reconnect(lease))
                .thenThrow(new ConnectionException(ErrorKind.THROTTLED, "Too many simultaneous connections", null));

        assertThatThrownBy(this::open)
                .isInstanceOf(ThrottledException.class)
                .extracting("kind").isEqualTo(ErrorKind.THROTTLED);
    }

    @Test
    @DisplayName("Dropped reconnect after authentication loss is transient")
    void testAuthenticationReconnectDropped() throws Exception {
        when(connection.openFolder("INBOX")).thenThrow(new TransportException("Not authenticated", "NOT_AUTHENTICATED"));
        when(connectionManager.reconnect(lease))
                .thenThrow(new ConnectionException(ErrorKind.CONNECTION_DROPPED, "Connection reset", null));

        assertThatThrownBy(this::open).isInstanceOf(TransientConnectionException.class);
    }

    @Test
    @DisplayName("Unclassified runtime failure is rethrown as-is after retries")
    void testUnclassifiedExhausted() {
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> executor.execute(policy, lease, "INBOX", c -> {
            throw boom;
        })).isSameAs(boom);
        verify(sleeper, times(3)).sleep(anyLong());
    }
}
