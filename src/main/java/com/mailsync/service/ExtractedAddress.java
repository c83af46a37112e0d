package com.mailsync.service;

/**
 * Sender or recipient as resolved by {@link AddressExtractor}; name may be null
 */
public record ExtractedAddress(String name, String email) {

    public static final ExtractedAddress EMPTY = new ExtractedAddress(null, "");
}
