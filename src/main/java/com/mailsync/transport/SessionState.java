package com.mailsync.transport;

public enum SessionState {
    NOT_AUTHENTICATED,
    AUTHENTICATED,
    LOGGED_OUT
}
