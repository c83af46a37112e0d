package com.mailsync.transport;

import java.util.List;

/**
 * One authenticated mailbox session. At most one folder is open at a time.
 */
public interface MailConnection {

    SessionState sessionState();

    /**
     * Lightweight round trip (NOOP)
     */
    void probe() throws TransportException;

    FolderInfo openFolder(String folderName) throws TransportException;

    /**
     * Enumerate UID and flags of every message in the open folder, ascending by UID
     */
    List<MessageRef> enumerate() throws TransportException;

    RawMessage fetch(long uid) throws TransportException;

    void close();
}
