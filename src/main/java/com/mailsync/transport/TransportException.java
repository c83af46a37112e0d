package com.mailsync.transport;

import lombok.Getter;

/**
 * Opaque failure reported by the mailbox server or the socket under it.
 * The code is a protocol response code (e.g. NONEXISTENT) when one is known.
 */
@Getter
public class TransportException extends Exception {

    private final String code;

    public TransportException(String message, String code) {
        super(message);
        this.code = code;
    }

    public TransportException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
