package com.mailsync.service;

import com.mailsync.parser.ParsedAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AddressExtractor unit tests
 */
class AddressExtractorTest {

    private final AddressExtractor extractor = new AddressExtractor();

    @Test
    @DisplayName("Display text \"Name\" <address> wins over structured entries")
    void testDisplayTextPattern() {
        ExtractedAddress result = extractor.extract("\"Alice Example\" <alice@example.com>",
                List.of(new ParsedAddress("Other", "other@example.com")));

        assertThat(result).isEqualTo(new ExtractedAddress("Alice Example", "alice@example.com"));
    }

    @Test
    @DisplayName("Unquoted name and bare <address> both match the pattern")
    void testPatternVariants() {
        assertThat(extractor.extract("Bob <bob@example.com>", List.of()))
                .isEqualTo(new ExtractedAddress("Bob", "bob@example.com"));
        assertThat(extractor.extract("<carol@example.com>", List.of()))
                .isEqualTo(new ExtractedAddress(null, "carol@example.com"));
    }

    @Test
    @DisplayName("First structured entry when the display text has no angle address")
    void testFirstStructured() {
        ExtractedAddress result = extractor.extract("dave@example.com, erin@example.com",
                List.of(new ParsedAddress("Dave", "dave@example.com"), new ParsedAddress(null, "erin@example.com")));

        assertThat(result).isEqualTo(new ExtractedAddress("Dave", "dave@example.com"));
    }

    @Test
    @DisplayName("Raw display text (first entry) when nothing is structured")
    void testRawDisplayText() {
        assertThat(extractor.extract("undisclosed-recipients, other", null))
                .isEqualTo(new ExtractedAddress(null, "undisclosed-recipients"));
    }

    @Test
    @DisplayName("Empty when there is nothing to read")
    void testEmpty() {
        assertThat(extractor.extract(null, List.of())).isEqualTo(ExtractedAddress.EMPTY);
        assertThat(extractor.extract("  ", null)).isEqualTo(ExtractedAddress.EMPTY);
    }

    @Test
    @DisplayName("Each strategy declines input it cannot read")
    void testStrategiesIndependently() {
        assertThat(AddressExtractor.DISPLAY_TEXT_PATTERN.extract("plain@example.com", null)).isEmpty();
        assertThat(AddressExtractor.FIRST_STRUCTURED.extract(null, List.of(new ParsedAddress("No address", " ")))).isEmpty();
        assertThat(AddressExtractor.RAW_DISPLAY_TEXT.extract("", null)).isEmpty();
    }
}
