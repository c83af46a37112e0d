package com.mailsync.domain;

/**
 * Attachment metadata stored as JSON on the message record
 */
public record AttachmentMeta(String filename, String contentType, long size, String cid) {
}
