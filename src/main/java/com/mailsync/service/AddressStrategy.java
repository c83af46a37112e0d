package com.mailsync.service;

import com.mailsync.parser.ParsedAddress;

import java.util.List;
import java.util.Optional;

/**
 * One way of reading an address header. Empty means "try the next strategy".
 */
@FunctionalInterface
public interface AddressStrategy {

    Optional<ExtractedAddress> extract(String displayText, List<ParsedAddress> structured);
}
