package com.mailsync.service;

import com.mailsync.domain.MailRecord;
import com.mailsync.domain.UpsertOutcome;
import com.mailsync.mapper.MailRecordMapper;
import com.mailsync.transport.RawMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Set;

/**
 * Idempotent message write keyed by (accountId, providerMessageId)
 * - The upsert statement returns observation_count; 1 means this call created the row
 * - A unique-key race (DuplicateKeyException or other integrity violation on the key) is
 *   resolved by re-reading the row and updating flags only; other storage errors propagate
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageUpsertService {

    private final MailRecordMapper mailRecordMapper;

    public UpsertResult upsert(long accountId, MailRecord record, Set<String> flags) {
        record.setAccountId(accountId);
        if (flags != null) {
            record.setIsRead(flags.contains(RawMessage.SEEN) ? 1 : 0);
            record.setIsStarred(flags.contains(RawMessage.FLAGGED) ? 1 : 0);
        }

        try {
            UpsertOutcome outcome = mailRecordMapper.upsert(record);
            record.setId(outcome.getId());
            if (outcome.isInserted()) {
                log.debug("Inserted {} (id={})", record.getProviderMessageId(), outcome.getId());
                return new UpsertResult(UpsertResult.Action.INSERTED, outcome.getId());
            }
            log.debug("Updated {} (id={}, seen {} times)", record.getProviderMessageId(), outcome.getId(),
                    outcome.getObservationCount());
            return new UpsertResult(UpsertResult.Action.UPDATED, outcome.getId());
        } catch (DataIntegrityViolationException e) {
            return resolveConflict(accountId, record, e);
        }
    }

    private UpsertResult resolveConflict(long accountId, MailRecord record, DataIntegrityViolationException conflict) {
        MailRecord existing = mailRecordMapper.findByProviderMessageId(accountId, record.getProviderMessageId());
        if (existing == null) {
            throw conflict;
        }
        mailRecordMapper.updateFlags(existing.getId(), record.getIsRead(), record.getIsStarred(), Instant.now().toString());
        record.setId(existing.getId());
        log.debug("Concurrent insert of {} resolved as update (id={})", record.getProviderMessageId(), existing.getId());
        return new UpsertResult(UpsertResult.Action.UPDATED, existing.getId());
    }
}
