package com.mailsync.parser;

/**
 * One structured address entry; name may be null
 */
public record ParsedAddress(String name, String address) {
}
