package com.mailsync.error;

/**
 * Connection dropped without an authentication signature.
 * Usually upstream rate limiting; the account is retried next cycle.
 */
public class TransientConnectionException extends MailSyncException {

    public TransientConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION_DROPPED, message, cause);
    }
}
