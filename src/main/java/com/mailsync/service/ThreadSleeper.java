package com.mailsync.service;

import com.mailsync.error.ErrorKind;
import com.mailsync.error.MailSyncException;
import org.springframework.stereotype.Component;

@Component
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailSyncException(ErrorKind.UNCLASSIFIED, "Sync interrupted", e);
        }
    }
}
