package com.mailsync.error;

import com.mailsync.config.SyncProperties;
import com.mailsync.transport.TransportException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps transport failures to an {@link ErrorKind}.
 * Signatures come from configuration since providers word errors differently.
 * Precedence: not-found, authentication, throttling, dropped connection.
 */
@Component
@RequiredArgsConstructor
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private final SyncProperties properties;

    public ErrorKind classify(Throwable error) {
        if (error == null) {
            return ErrorKind.UNCLASSIFIED;
        }

        List<String> texts = new ArrayList<>();
        List<String> codes = new ArrayList<>();
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof MailSyncException syncException
                    && syncException.getKind() != ErrorKind.UNCLASSIFIED) {
                return syncException.getKind();
            }
            if (current.getMessage() != null) {
                texts.add(current.getMessage().toLowerCase(Locale.ROOT));
            }
            if (current instanceof TransportException transportException && transportException.getCode() != null) {
                codes.add(transportException.getCode().toUpperCase(Locale.ROOT));
            }
            current = current.getCause();
        }

        SyncProperties.Errors signatures = properties.getErrors();
        if (matches(texts, codes, signatures.getNotFound(), signatures.getNotFoundCodes())) {
            return ErrorKind.NOT_FOUND;
        }
        if (matches(texts, codes, signatures.getAuthentication(), signatures.getAuthenticationCodes())) {
            return ErrorKind.AUTHENTICATION;
        }
        if (matches(texts, codes, signatures.getThrottle(), signatures.getThrottleCodes())) {
            return ErrorKind.THROTTLED;
        }
        if (matches(texts, codes, signatures.getConnectionDropped(), signatures.getConnectionDroppedCodes())) {
            return ErrorKind.CONNECTION_DROPPED;
        }
        return ErrorKind.UNCLASSIFIED;
    }

    public boolean isThrottling(Throwable error) {
        return classify(error) == ErrorKind.THROTTLED;
    }

    private boolean matches(List<String> texts, List<String> codes, List<String> patterns, List<String> codePatterns) {
        for (String code : codes) {
            for (String codePattern : codePatterns) {
                if (code.equals(codePattern.toUpperCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        for (String text : texts) {
            for (String pattern : patterns) {
                if (text.contains(pattern.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }
}
