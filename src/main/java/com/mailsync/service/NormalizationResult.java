package com.mailsync.service;

import com.mailsync.domain.MailRecord;

/**
 * Either a record or the reason the message was skipped
 */
public record NormalizationResult(MailRecord record, String failureReason) {

    public static NormalizationResult success(MailRecord record) {
        return new NormalizationResult(record, null);
    }

    public static NormalizationResult failure(String reason) {
        return new NormalizationResult(null, reason);
    }

    public boolean isSuccess() {
        return record != null;
    }
}
