package com.mailsync.error;

/**
 * Upstream rate limit that outlasted the retry budget
 */
public class ThrottledException extends MailSyncException {

    public ThrottledException(String message, Throwable cause) {
        super(ErrorKind.THROTTLED, message, cause);
    }
}
