package com.mailsync.transport;

import com.mailsync.domain.EmailAccount;

/**
 * Opens authenticated mailbox sessions
 */
public interface MailTransport {

    MailConnection connect(EmailAccount account) throws TransportException;
}
