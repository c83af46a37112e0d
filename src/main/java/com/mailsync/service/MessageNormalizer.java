package com.mailsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailsync.config.SyncProperties;
import com.mailsync.domain.AttachmentMeta;
import com.mailsync.domain.MailRecord;
import com.mailsync.parser.MailParser;
import com.mailsync.parser.ParsedAttachment;
import com.mailsync.parser.ParsedMail;
import com.mailsync.transport.RawMessage;
import com.mailsync.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Raw IMAP message to canonical {@link MailRecord}
 * - Subject truncated to mailsync.sync.subject-max-length, "(No Subject)" when missing
 * - Read/starred taken from \Seen / \Flagged at fetch time
 * - Attachment metadata stored as a JSON array
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageNormalizer {

    static final String NO_SUBJECT = "(No Subject)";
    static final String UNKNOWN_SENDER = "Unknown";

    private final MailParser mailParser;
    private final AddressExtractor addressExtractor;
    private final ObjectMapper objectMapper;
    private final SyncProperties properties;

    public NormalizationResult normalize(RawMessage raw, String folderName, long accountId) {
        try {
            ParsedMail mail = mailParser.parse(raw.content());

            ExtractedAddress sender = addressExtractor.extract(mail.getFromText(), mail.getFromAddresses());
            ExtractedAddress recipient = addressExtractor.extract(mail.getToText(), mail.getToAddresses());

            List<AttachmentMeta> attachments = mail.getAttachments().stream()
                    .map(MessageNormalizer::toMeta)
                    .toList();

            MailRecord record = MailRecord.builder()
                    .accountId(accountId)
                    .providerMessageId(MailRecord.providerMessageId(accountId, raw.uid(), folderName))
                    .uid(raw.uid())
                    .folderName(folderName)
                    .senderName(senderName(sender))
                    .senderEmail(sender.email())
                    .recipientEmail(recipient.email())
                    .subject(subject(mail.getSubject()))
                    .bodyText(mail.getText() != null ? mail.getText() : "")
                    .bodyHtml(mail.getHtml() != null ? mail.getHtml() : "")
                    .receivedAt((mail.getDate() != null ? mail.getDate() : Instant.now()).toString())
                    .isRead(raw.isSeen() ? 1 : 0)
                    .isStarred(raw.isFlagged() ? 1 : 0)
                    .isDeleted(0)
                    .attachmentsMeta(objectMapper.writeValueAsString(attachments))
                    .attachmentsCount(attachments.size())
                    .build();
            return NormalizationResult.success(record);
        } catch (JsonProcessingException e) {
            log.warn("Attachment metadata serialization failed for UID {} in {}: {}", raw.uid(), folderName, e.getMessage());
            return NormalizationResult.failure("attachment metadata: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to normalize UID {} in {}: {}", raw.uid(), folderName, e.getMessage());
            return NormalizationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    String subject(String subject) {
        if (subject == null || subject.isBlank()) {
            return NO_SUBJECT;
        }
        int max = properties.getSync().getSubjectMaxLength();
        if (subject.length() <= max) {
            return subject;
        }
        int end = Character.isHighSurrogate(subject.charAt(max - 1)) ? max - 1 : max;
        return subject.substring(0, end);
    }

    private static String senderName(ExtractedAddress sender) {
        if (sender.name() != null && !sender.name().isBlank()) {
            return sender.name();
        }
        String localPart = CryptoUtil.extractLocalPart(sender.email());
        return localPart != null && !localPart.isBlank() ? localPart : UNKNOWN_SENDER;
    }

    private static AttachmentMeta toMeta(ParsedAttachment attachment) {
        return new AttachmentMeta(attachment.filename(), attachment.contentType(), attachment.size(), attachment.contentId());
    }
}
