package com.mailsync.transport;

import java.util.Set;

/**
 * Full RFC 822 content of one message plus its flags at fetch time
 */
public record RawMessage(long uid, Set<String> flags, byte[] content) {

    public static final String SEEN = "\\Seen";
    public static final String FLAGGED = "\\Flagged";

    public boolean isSeen() {
        return flags != null && flags.contains(SEEN);
    }

    public boolean isFlagged() {
        return flags != null && flags.contains(FLAGGED);
    }
}
