package com.mailsync.service;

import com.mailsync.domain.EmailAccount;
import com.mailsync.transport.MailConnection;

/**
 * Account-scoped handle on the pooled connection.
 * The underlying connection may be swapped by a reconnect; callers always go through {@link #connection()}.
 */
public class ConnectionLease {

    private final EmailAccount account;
    private volatile MailConnection connection;

    ConnectionLease(EmailAccount account, MailConnection connection) {
        this.account = account;
        this.connection = connection;
    }

    public long accountId() {
        return account.getId();
    }

    public EmailAccount account() {
        return account;
    }

    public MailConnection connection() {
        return connection;
    }

    void swap(MailConnection connection) {
        this.connection = connection;
    }
}
