package com.mailsync.queue;

import com.mailsync.domain.MailRecord;

/**
 * Downstream notification for newly inserted messages.
 * Skips come back as a result; a failed hand-off is thrown. Callers never treat either as fatal.
 */
public interface MailNotifier {

    NotifyResult notify(MailRecord record, long accountId, String userId);
}
