package com.mailsync.error;

import lombok.Getter;

/**
 * Base of all sync failures, tagged with the kind that drives recovery
 */
@Getter
public class MailSyncException extends RuntimeException {

    private final ErrorKind kind;

    public MailSyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MailSyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
