package com.mailsync.transport;

import com.mailsync.config.SyncProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ImapMailTransport unit tests
 */
class ImapMailTransportTest {

    @Test
    @DisplayName("Session properties carry timeouts and read-only peek")
    void testSessionProperties() {
        SyncProperties properties = new SyncProperties();
        properties.getTransport().setConnectTimeoutMs(5000);
        properties.getTransport().setReadTimeoutMs(15000);
        ImapMailTransport transport = new ImapMailTransport(properties);

        Properties props = transport.sessionProperties("imaps", "imap.example.com", 993);

        assertThat(props.getProperty("mail.store.protocol")).isEqualTo("imaps");
        assertThat(props.getProperty("mail.imaps.host")).isEqualTo("imap.example.com");
        assertThat(props.getProperty("mail.imaps.port")).isEqualTo("993");
        assertThat(props.getProperty("mail.imaps.connectiontimeout")).isEqualTo("5000");
        assertThat(props.getProperty("mail.imaps.timeout")).isEqualTo("15000");
        assertThat(props.getProperty("mail.imaps.peek")).isEqualTo("true");
        assertThat(props.getProperty("mail.imaps.ssl.trust")).isNull();
    }

    @Test
    @DisplayName("Certificate checks are relaxed only when opted in")
    void testTrustAllOptIn() {
        SyncProperties properties = new SyncProperties();
        properties.getTransport().setTrustAllCertificates(true);

        Properties props = new ImapMailTransport(properties).sessionProperties("imap", "mail.local", 143);

        assertThat(props.getProperty("mail.imap.ssl.trust")).isEqualTo("*");
    }
}
