package com.mailsync.parser;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Parsed message.
 * Sender/recipient come both as the decoded header text and as structured entries.
 */
@Value
@Builder
public class ParsedMail {

    String fromText;
    @Singular
    List<ParsedAddress> fromAddresses;
    String toText;
    @Singular
    List<ParsedAddress> toAddresses;
    String subject;
    Instant date;
    String text;
    String html;
    @Singular
    List<ParsedAttachment> attachments;
}
