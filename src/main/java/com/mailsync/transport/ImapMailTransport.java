package com.mailsync.transport;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.EmailAccount;
import com.mailsync.util.CryptoUtil;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Jakarta Mail IMAP transport
 * - imaps when the account uses SSL, plain imap otherwise
 * - Connect/read/write timeouts from mailsync.transport
 * - Passwords stored as "iv:cipher" are decrypted with mailsync.security.encryption-key
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImapMailTransport implements MailTransport {

    private final SyncProperties properties;

    @Override
    public MailConnection connect(EmailAccount account) throws TransportException {
        String protocol = account.getUseSsl() == 1 ? "imaps" : "imap";
        int port = account.getImapPort() != null ? account.getImapPort() : (account.getUseSsl() == 1 ? 993 : 143);
        String password = resolvePassword(account);

        Session session = Session.getInstance(sessionProperties(protocol, account.getImapHost(), port));
        try {
            Store store = session.getStore(protocol);
            store.connect(account.getImapHost(), port, account.getImapUsername(), password);
            log.debug("IMAP session opened: account={}, host={}:{}", account.getId(), account.getImapHost(), port);
            return new ImapMailConnection(store);
        } catch (MessagingException e) {
            throw ImapMailConnection.translate(e);
        }
    }

    Properties sessionProperties(String protocol, String host, int port) {
        SyncProperties.Transport transport = properties.getTransport();
        String prefix = "mail." + protocol + ".";
        Properties props = new Properties();
        props.setProperty("mail.store.protocol", protocol);
        props.setProperty(prefix + "host", host);
        props.setProperty(prefix + "port", String.valueOf(port));
        props.setProperty(prefix + "connectiontimeout", String.valueOf(transport.getConnectTimeoutMs()));
        props.setProperty(prefix + "timeout", String.valueOf(transport.getReadTimeoutMs()));
        props.setProperty(prefix + "writetimeout", String.valueOf(transport.getReadTimeoutMs()));
        props.setProperty(prefix + "peek", "true");
        if (transport.isTrustAllCertificates()) {
            props.setProperty(prefix + "ssl.trust", "*");
        }
        return props;
    }

    private String resolvePassword(EmailAccount account) throws TransportException {
        String stored = account.getImapPassword();
        String key = properties.getSecurity().getEncryptionKey();
        if (key == null || key.isBlank() || !CryptoUtil.isEncrypted(stored)) {
            return stored;
        }
        try {
            return CryptoUtil.decryptPassword(stored, key);
        } catch (RuntimeException e) {
            throw new TransportException("Failed to decrypt IMAP password: " + e.getMessage(),
                    "AUTHENTICATIONFAILED", e);
        }
    }
}
