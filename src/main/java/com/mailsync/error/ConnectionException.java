package com.mailsync.error;

/**
 * A fresh connection still failed its health check.
 * Fatal for the current sync attempt.
 */
public class ConnectionException extends MailSyncException {

    public ConnectionException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
