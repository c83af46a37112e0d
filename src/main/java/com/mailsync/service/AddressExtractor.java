package com.mailsync.service;

import com.mailsync.parser.ParsedAddress;
import com.mailsync.util.CryptoUtil;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves sender/recipient from loosely formatted headers.
 * Strategies run in order and the first match wins:
 * display text "Name" &lt;address&gt;, first structured entry, raw display text, empty.
 */
@Component
public class AddressExtractor {

    private static final Pattern NAME_ADDR = Pattern.compile("\"?([^\"<]*)\"?\\s*<([^>]+)>");

    static final AddressStrategy DISPLAY_TEXT_PATTERN = (displayText, structured) -> {
        if (displayText == null) return Optional.empty();
        Matcher matcher = NAME_ADDR.matcher(displayText);
        if (!matcher.find()) return Optional.empty();
        String name = matcher.group(1).trim();
        return Optional.of(new ExtractedAddress(name.isEmpty() ? null : name, matcher.group(2).trim()));
    };

    static final AddressStrategy FIRST_STRUCTURED = (displayText, structured) -> {
        if (structured == null || structured.isEmpty()) return Optional.empty();
        ParsedAddress first = structured.get(0);
        if (first.address() == null || first.address().isBlank()) return Optional.empty();
        String name = first.name() != null && !first.name().isBlank() ? first.name().trim() : null;
        return Optional.of(new ExtractedAddress(name, first.address().trim()));
    };

    static final AddressStrategy RAW_DISPLAY_TEXT = (displayText, structured) -> {
        if (displayText == null || displayText.isBlank()) return Optional.empty();
        String first = displayText.split(",")[0];
        return Optional.of(new ExtractedAddress(null, CryptoUtil.stripAngleBrackets(first)));
    };

    private final List<AddressStrategy> strategies = List.of(DISPLAY_TEXT_PATTERN, FIRST_STRUCTURED, RAW_DISPLAY_TEXT);

    public ExtractedAddress extract(String displayText, List<ParsedAddress> structured) {
        for (AddressStrategy strategy : strategies) {
            Optional<ExtractedAddress> result = strategy.extract(displayText, structured);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return ExtractedAddress.EMPTY;
    }
}
