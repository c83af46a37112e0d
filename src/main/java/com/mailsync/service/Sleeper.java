package com.mailsync.service;

/**
 * Blocking pause used between batches and retries
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis);
}
