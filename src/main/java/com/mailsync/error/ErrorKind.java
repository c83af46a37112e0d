package com.mailsync.error;

/**
 * Closed set of failure kinds the sync engine reacts to
 */
public enum ErrorKind {
    THROTTLED,
    AUTHENTICATION,
    NOT_FOUND,
    CONNECTION_DROPPED,
    MALFORMED_MESSAGE,
    UNCLASSIFIED
}
