package com.mailsync.transport;

import java.util.Set;

/**
 * UID and flags of one message as enumerated in the open folder
 */
public record MessageRef(long uid, Set<String> flags) {
}
