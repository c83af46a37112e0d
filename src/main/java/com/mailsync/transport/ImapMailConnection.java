package com.mailsync.transport;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.FolderNotFoundException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import jakarta.mail.UIDFolder;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * IMAP session over a Jakarta Mail {@link Store}.
 * Folders are opened read-only (EXAMINE); syncing never alters server flags.
 */
@Slf4j
public class ImapMailConnection implements MailConnection {

    private final Store store;
    private Folder folder;
    private volatile boolean closed;

    public ImapMailConnection(Store store) {
        this.store = store;
    }

    @Override
    public SessionState sessionState() {
        if (closed) {
            return SessionState.LOGGED_OUT;
        }
        return store.isConnected() ? SessionState.AUTHENTICATED : SessionState.NOT_AUTHENTICATED;
    }

    @Override
    public void probe() throws TransportException {
        // IMAPStore.isConnected() issues a NOOP
        if (closed || !store.isConnected()) {
            throw new TransportException("Connection closed", "CLOSED");
        }
    }

    @Override
    public FolderInfo openFolder(String folderName) throws TransportException {
        try {
            closeCurrentFolder();
            Folder target = store.getFolder(folderName);
            if (!target.exists()) {
                throw new TransportException("Unknown Mailbox: " + folderName, "NONEXISTENT");
            }
            target.open(Folder.READ_ONLY);
            folder = target;
            long uidValidity = target instanceof UIDFolder uidFolder ? uidFolder.getUIDValidity() : 0L;
            return new FolderInfo(folderName, target.getMessageCount(), uidValidity);
        } catch (MessagingException e) {
            throw translate(e);
        }
    }

    @Override
    public List<MessageRef> enumerate() throws TransportException {
        UIDFolder uidFolder = requireOpenFolder();
        try {
            Message[] messages = folder.getMessages();
            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            profile.add(FetchProfile.Item.FLAGS);
            folder.fetch(messages, profile);

            List<MessageRef> refs = new ArrayList<>(messages.length);
            for (Message message : messages) {
                refs.add(new MessageRef(uidFolder.getUID(message), toFlagNames(message.getFlags())));
            }
            refs.sort(Comparator.comparingLong(MessageRef::uid));
            return refs;
        } catch (MessagingException e) {
            throw translate(e);
        }
    }

    @Override
    public RawMessage fetch(long uid) throws TransportException {
        UIDFolder uidFolder = requireOpenFolder();
        try {
            Message message = uidFolder.getMessageByUID(uid);
            if (message == null) {
                throw new TransportException("Message UID " + uid + " does not exist", "NONEXISTENT");
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            return new RawMessage(uid, toFlagNames(message.getFlags()), out.toByteArray());
        } catch (MessagingException e) {
            throw translate(e);
        } catch (IOException e) {
            throw new TransportException("Failed to read message UID " + uid + ": " + e.getMessage(), null, e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            closeCurrentFolder();
        } catch (MessagingException e) {
            log.debug("Folder close failed: {}", e.getMessage());
        }
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Store close failed: {}", e.getMessage());
        }
    }

    private UIDFolder requireOpenFolder() throws TransportException {
        if (folder == null || !folder.isOpen()) {
            throw new TransportException("No folder is open", "CLOSED");
        }
        if (!(folder instanceof UIDFolder uidFolder)) {
            throw new TransportException("Folder does not support UIDs", null);
        }
        return uidFolder;
    }

    private void closeCurrentFolder() throws MessagingException {
        if (folder != null && folder.isOpen()) {
            folder.close(false);
        }
        folder = null;
    }

    static Set<String> toFlagNames(Flags flags) {
        Set<String> names = new LinkedHashSet<>();
        if (flags == null) {
            return names;
        }
        for (Flags.Flag flag : flags.getSystemFlags()) {
            if (flag == Flags.Flag.SEEN) names.add("\\Seen");
            else if (flag == Flags.Flag.FLAGGED) names.add("\\Flagged");
            else if (flag == Flags.Flag.ANSWERED) names.add("\\Answered");
            else if (flag == Flags.Flag.DELETED) names.add("\\Deleted");
            else if (flag == Flags.Flag.DRAFT) names.add("\\Draft");
            else if (flag == Flags.Flag.RECENT) names.add("\\Recent");
        }
        for (String userFlag : flags.getUserFlags()) {
            names.add(userFlag);
        }
        return names;
    }

    /**
     * Attach a protocol code to a Jakarta Mail failure
     */
    static TransportException translate(MessagingException e) {
        String code = null;
        if (e instanceof FolderNotFoundException) {
            code = "NONEXISTENT";
        } else if (e instanceof AuthenticationFailedException) {
            code = "AUTHENTICATIONFAILED";
        } else if (e instanceof StoreClosedException || e instanceof FolderClosedException) {
            code = "CLOSED";
        }
        String message = e.getMessage();
        if (e.getNextException() != null && e.getNextException().getMessage() != null) {
            message = message + ": " + e.getNextException().getMessage();
        }
        return new TransportException(message != null ? message : e.getClass().getSimpleName(), code, e);
    }
}
