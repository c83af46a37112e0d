package com.mailsync.error;

/**
 * Message could not be turned into a canonical record
 */
public class NormalizationException extends MailSyncException {

    public NormalizationException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_MESSAGE, message, cause);
    }
}
