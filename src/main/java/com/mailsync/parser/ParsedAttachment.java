package com.mailsync.parser;

public record ParsedAttachment(String filename, String contentType, long size, String contentId) {
}
