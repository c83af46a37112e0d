package com.mailsync.queue;

public record NotifyResult(boolean delivered, String reason) {

    public static NotifyResult queued() {
        return new NotifyResult(true, "queued");
    }

    public static NotifyResult skipped(String reason) {
        return new NotifyResult(false, reason);
    }
}
