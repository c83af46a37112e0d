package com.mailsync.parser;

import com.mailsync.error.NormalizationException;
import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Locale;
import java.util.Properties;

/**
 * MIME parser based on Jakarta Mail
 * - First text/plain and text/html parts become the bodies
 * - Other leaf parts (or any part with attachment disposition) become attachment metadata
 * - Address headers that fail strict parsing keep only their display text
 */
@Slf4j
@Component
public class MimeMailParser implements MailParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.address.strict", "false");
        SESSION = Session.getInstance(props);
    }

    @Override
    public ParsedMail parse(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new NormalizationException("Empty message content", null);
        }
        try (InputStream is = new ByteArrayInputStream(raw)) {
            MimeMessage message = new MimeMessage(SESSION, is);
            ParsedMail.ParsedMailBuilder builder = ParsedMail.builder()
                    .subject(message.getSubject());

            String fromHeader = message.getHeader("From", ",");
            builder.fromText(decode(fromHeader));
            addAddresses(fromHeader, builder, true);

            String toHeader = message.getHeader("To", ",");
            builder.toText(decode(toHeader));
            addAddresses(toHeader, builder, false);

            Date sent = message.getSentDate();
            if (sent != null) {
                builder.date(sent.toInstant());
            }

            BodyCollector collector = new BodyCollector(builder);
            collector.walk(message);
            builder.text(collector.text).html(collector.html);
            return builder.build();
        } catch (MessagingException | IOException e) {
            throw new NormalizationException("Failed to parse message: " + e.getMessage(), e);
        }
    }

    private static String decode(String header) {
        if (header == null) return null;
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(header));
        } catch (UnsupportedEncodingException e) {
            return header;
        }
    }

    private static void addAddresses(String header, ParsedMail.ParsedMailBuilder builder, boolean sender) {
        if (header == null || header.isBlank()) return;
        try {
            for (Address address : InternetAddress.parseHeader(header, false)) {
                if (address instanceof InternetAddress internetAddress && internetAddress.getAddress() != null) {
                    ParsedAddress parsed = new ParsedAddress(internetAddress.getPersonal(), internetAddress.getAddress());
                    if (sender) builder.fromAddress(parsed);
                    else builder.toAddress(parsed);
                }
            }
        } catch (AddressException e) {
            log.debug("Unparseable address header [{}]: {}", header, e.getMessage());
        }
    }

    private static final class BodyCollector {
        private final ParsedMail.ParsedMailBuilder builder;
        private String text;
        private String html;

        BodyCollector(ParsedMail.ParsedMailBuilder builder) {
            this.builder = builder;
        }

        void walk(Part part) throws MessagingException, IOException {
            if (part.isMimeType("multipart/*")) {
                Multipart multipart = (Multipart) part.getContent();
                for (int i = 0; i < multipart.getCount(); i++) {
                    BodyPart child = multipart.getBodyPart(i);
                    walk(child);
                }
                return;
            }

            boolean attachment = Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()) || part.getFileName() != null;
            if (!attachment && part.isMimeType("text/plain") && text == null) {
                text = readText(part);
            } else if (!attachment && part.isMimeType("text/html") && html == null) {
                html = readText(part);
            } else {
                builder.attachment(toAttachment(part));
            }
        }

        private String readText(Part part) throws MessagingException, IOException {
            Object content = part.getContent();
            if (content instanceof String s) {
                return s;
            }
            try (InputStream in = part.getInputStream()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        private ParsedAttachment toAttachment(Part part) throws MessagingException, IOException {
            String filename = part.getFileName();
            if (filename != null) {
                filename = decode(filename);
            }
            String contentType = part.getContentType();
            if (contentType != null) {
                int semicolon = contentType.indexOf(';');
                contentType = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType)
                        .trim().toLowerCase(Locale.ROOT);
            }
            long size;
            try (InputStream in = part.getInputStream()) {
                size = in.readAllBytes().length;
            }
            String contentId = part instanceof MimePart mimePart ? mimePart.getContentID() : null;
            return new ParsedAttachment(filename, contentType, size, contentId);
        }
    }
}
