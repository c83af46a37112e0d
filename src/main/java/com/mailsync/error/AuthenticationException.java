package com.mailsync.error;

/**
 * Session could not be (re)authenticated
 */
public class AuthenticationException extends MailSyncException {

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
