package com.mailsync.error;

/**
 * Folder does not exist on the server
 */
public class FolderNotFoundException extends MailSyncException {

    public FolderNotFoundException(String folderName, Throwable cause) {
        super(ErrorKind.NOT_FOUND, "Folder " + folderName + " does not exist", cause);
    }
}
