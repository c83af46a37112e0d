package com.mailsync.error;

import com.mailsync.config.SyncProperties;
import com.mailsync.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ErrorClassifier unit tests
 */
class ErrorClassifierTest {

    private SyncProperties properties;
    private ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        classifier = new ErrorClassifier(properties);
    }

    @Test
    @DisplayName("Unknown Mailbox and NONEXISTENT are not-found")
    void testNotFound() {
        assertThat(classifier.classify(new TransportException("Unknown Mailbox: Archive", null)))
                .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(classifier.classify(new TransportException("SELECT failed", "NONEXISTENT")))
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Authentication signatures by message and by code")
    void testAuthentication() {
        assertThat(classifier.classify(new TransportException("Not authenticated", null)))
                .isEqualTo(ErrorKind.AUTHENTICATION);
        assertThat(classifier.classify(new TransportException("LOGIN rejected", "AUTHENTICATIONFAILED")))
                .isEqualTo(ErrorKind.AUTHENTICATION);
    }

    @Test
    @DisplayName("Provider rate limiting is throttling")
    void testThrottling() {
        assertThat(classifier.classify(new TransportException("[THROTTLED] Account exceeded command limit", null)))
                .isEqualTo(ErrorKind.THROTTLED);
        assertThat(classifier.isThrottling(new RuntimeException("Too many requests, try again later"))).isTrue();
    }

    @Test
    @DisplayName("Dropped connections without an auth signature")
    void testConnectionDropped() {
        assertThat(classifier.classify(new TransportException("Connection ended unexpectedly", null)))
                .isEqualTo(ErrorKind.CONNECTION_DROPPED);
        assertThat(classifier.classify(new TransportException("* BYE", "BYE")))
                .isEqualTo(ErrorKind.CONNECTION_DROPPED);
    }

    @Test
    @DisplayName("Signatures are found anywhere in the cause chain")
    void testCauseChain() {
        Exception wrapped = new RuntimeException("fetch failed",
                new IOException("socket", new TransportException("Rate limit exceeded", null)));

        assertThat(classifier.classify(wrapped)).isEqualTo(ErrorKind.THROTTLED);
    }

    @Test
    @DisplayName("Not-found takes precedence over other signatures")
    void testPrecedence() {
        assertThat(classifier.classify(new TransportException("Mailbox does not exist, try again", null)))
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Typed sync exceptions keep their kind")
    void testTypedException() {
        assertThat(classifier.classify(new ThrottledException("exhausted", null))).isEqualTo(ErrorKind.THROTTLED);
        assertThat(classifier.classify(new ConnectionException(ErrorKind.AUTHENTICATION, "fresh connection", null)))
                .isEqualTo(ErrorKind.AUTHENTICATION);
    }

    @Test
    @DisplayName("Unclassified sync exception falls through to its cause")
    void testUnclassifiedWrapper() {
        MailSyncException wrapper = new MailSyncException(ErrorKind.UNCLASSIFIED, "failed",
                new TransportException("Connection reset", null));

        assertThat(classifier.classify(wrapper)).isEqualTo(ErrorKind.CONNECTION_DROPPED);
    }

    @Test
    @DisplayName("Signatures come from configuration")
    void testConfiguredSignature() {
        TransportException providerSpecific = new TransportException("Mailbox is busy, slow down", null);
        assertThat(classifier.classify(providerSpecific)).isEqualTo(ErrorKind.UNCLASSIFIED);

        properties.getErrors().getThrottle().add("slow down");

        assertThat(classifier.classify(providerSpecific)).isEqualTo(ErrorKind.THROTTLED);
    }

    @Test
    @DisplayName("Unknown errors and null are unclassified")
    void testUnclassified() {
        assertThat(classifier.classify(new IllegalArgumentException("bad uid"))).isEqualTo(ErrorKind.UNCLASSIFIED);
        assertThat(classifier.classify(null)).isEqualTo(ErrorKind.UNCLASSIFIED);
    }
}
