package com.mailsync.transport;

/**
 * Result of opening a folder
 */
public record FolderInfo(String name, int totalCount, long uidValidity) {
}
