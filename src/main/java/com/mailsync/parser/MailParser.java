package com.mailsync.parser;

/**
 * Decodes raw RFC 822 bytes into headers, bodies and attachments.
 * Pure: no I/O beyond the given bytes.
 */
public interface MailParser {

    /**
     * @throws com.mailsync.error.NormalizationException if the content cannot be decoded
     */
    ParsedMail parse(byte[] raw);
}
