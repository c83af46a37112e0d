package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.EmailAccount;
import com.mailsync.domain.FolderCursor;
import com.mailsync.domain.MailRecord;
import com.mailsync.domain.SyncLogEntry;
import com.mailsync.error.AuthenticationException;
import com.mailsync.error.ConnectionException;
import com.mailsync.error.ErrorClassifier;
import com.mailsync.error.FolderNotFoundException;
import com.mailsync.error.ThrottledException;
import com.mailsync.error.TransientConnectionException;
import com.mailsync.mapper.EmailAccountMapper;
import com.mailsync.mapper.SyncLogMapper;
import com.mailsync.queue.MailNotifier;
import com.mailsync.queue.NotifyResult;
import com.mailsync.transport.FolderInfo;
import com.mailsync.transport.MailConnection;
import com.mailsync.transport.MessageRef;
import com.mailsync.transport.RawMessage;
import com.mailsync.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Incremental sync of one folder
 *
 * verify connection -> load cursor -> open folder (retried) -> enumerate all UIDs (retried)
 * -> keep UIDs above the cursor -> batches of mailsync.sync.batch-size with a delay between them
 * -> fetch, normalize, upsert, notify on insert -> advance cursor -> append sync log
 *
 * Folder-level failures come back as flags on {@link FolderSyncResult}.
 * Only a connection that cannot be made healthy ({@link ConnectionException}) or an unreadable cursor is thrown;
 * the sync log entry is written either way.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FolderSyncEngine {

    static final String SYNC_TYPE = "incremental";

    private final ConnectionManager connectionManager;
    private final RetryExecutor retryExecutor;
    private final CursorService cursorService;
    private final MessageNormalizer normalizer;
    private final MessageUpsertService upsertService;
    private final MailNotifier notifier;
    private final ErrorClassifier errorClassifier;
    private final EmailAccountMapper accountMapper;
    private final SyncLogMapper syncLogMapper;
    private final Sleeper sleeper;
    private final SyncProperties properties;

    /**
     * Running counts of one pass
     */
    private static final class Progress {
        int fetched;
        int saved;
        int updated;
        int errors;
        int notificationFailures;
        long highestUid;

        FolderSyncResult.FolderSyncResultBuilder toResult(String folderName, long startedAt) {
            return FolderSyncResult.builder()
                    .folderName(folderName)
                    .fetched(fetched)
                    .saved(saved)
                    .updated(updated)
                    .errors(errors)
                    .notificationFailures(notificationFailures)
                    .durationMs(System.currentTimeMillis() - startedAt);
        }
    }

    public FolderSyncResult syncFolder(ConnectionLease lease, EmailAccount account, String folderName) {
        long startedAt = System.currentTimeMillis();
        long accountId = account.getId();
        log.info("Syncing folder {} for account {}", folderName, accountId);

        FolderCursor cursor;
        try {
            connectionManager.ensureHealthy(lease);
            cursor = cursorService.get(accountId, folderName);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Cannot start sync of {} for account {}: {}", folderName, accountId, message);
            writeSyncLog(accountId, FolderSyncResult.builder()
                    .folderName(folderName)
                    .errors(1)
                    .durationMs(System.currentTimeMillis() - startedAt)
                    .error(message)
                    .build());
            throw e;
        }
        long lastUid = cursor.getLastUidSynced();
        Progress progress = new Progress();
        progress.highestUid = lastUid;

        FolderSyncResult result;
        try {
            sync(lease, account, folderName, lastUid, progress);
            result = progress.toResult(folderName, startedAt).build();
        } catch (FolderNotFoundException e) {
            log.warn("Folder {} not found for account {}, skipping", folderName, accountId);
            result = FolderSyncResult.builder()
                    .folderName(folderName)
                    .notFound(true)
                    .durationMs(System.currentTimeMillis() - startedAt)
                    .build();
        } catch (ThrottledException | TransientConnectionException e) {
            log.error("Folder {} for account {} throttled: {}", folderName, accountId, e.getMessage());
            progress.errors++;
            cursorService.recordError(accountId, folderName, truncate(e.getMessage()));
            result = progress.toResult(folderName, startedAt).throttled(true).error(e.getMessage()).build();
        } catch (AuthenticationException e) {
            log.error("Authentication failed syncing folder {} for account {}: {}", folderName, accountId, e.getMessage());
            progress.errors++;
            accountMapper.markNeedsReconnection(accountId, truncate(e.getMessage()), Instant.now().toString());
            cursorService.recordError(accountId, folderName, truncate(e.getMessage()));
            result = progress.toResult(folderName, startedAt).authFailed(true).error(e.getMessage()).build();
        } catch (ConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error syncing folder {} for account {}", folderName, accountId, e);
            progress.errors++;
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            cursorService.recordError(accountId, folderName, truncate(message));
            result = progress.toResult(folderName, startedAt).error(message).build();
        }

        log.info("Completed {} for account {}: fetched={}, saved={}, updated={}, errors={}, duration={}ms",
                folderName, accountId, result.getFetched(), result.getSaved(), result.getUpdated(),
                result.getErrors(), result.getDurationMs());
        writeSyncLog(accountId, result);
        return result;
    }

    private void sync(ConnectionLease lease, EmailAccount account, String folderName, long lastUid, Progress progress) {
        long accountId = account.getId();
        SyncProperties.Sync config = properties.getSync();
        AtomicReference<MailConnection> openedOn = new AtomicReference<>();

        FolderInfo folder = retryExecutor.execute(RetryPolicy.of("Opening folder " + folderName, config.getFolderOpen()),
                lease, folderName, connection -> {
                    FolderInfo info = connection.openFolder(folderName);
                    openedOn.set(connection);
                    return info;
                });
        log.debug("Opened {} for account {}: {} messages", folderName, accountId, folder.totalCount());

        List<MessageRef> all = retryExecutor.execute(RetryPolicy.of("Enumerating " + folderName, config.getEnumerate()),
                lease, folderName, connection -> {
                    if (openedOn.get() != connection) {
                        connection.openFolder(folderName);
                        openedOn.set(connection);
                    }
                    return connection.enumerate();
                });

        List<MessageRef> fresh = all.stream()
                .filter(ref -> ref.uid() > lastUid)
                .sorted(Comparator.comparingLong(MessageRef::uid))
                .toList();

        if (fresh.isEmpty()) {
            log.debug("No new messages in {} for account {}", folderName, accountId);
            cursorService.advance(accountId, folderName, lastUid, folder.totalCount());
            return;
        }

        log.info("Found {} new messages in {} for account {}", fresh.size(), folderName, accountId);
        try {
            processBatches(lease, account, folderName, fresh, progress);
        } finally {
            cursorService.advance(accountId, folderName, Math.max(lastUid, progress.highestUid), folder.totalCount());
        }
    }

    private void processBatches(ConnectionLease lease, EmailAccount account, String folderName,
                                List<MessageRef> fresh, Progress progress) {
        SyncProperties.Sync config = properties.getSync();
        int batchSize = Math.max(1, config.getBatchSize());
        int batchCount = (fresh.size() + batchSize - 1) / batchSize;

        for (int batchIndex = 0; batchIndex < batchCount; batchIndex++) {
            if (batchIndex > 0) {
                log.debug("Waiting {}ms before batch {}/{}", config.getBatchDelayMs(), batchIndex + 1, batchCount);
                sleeper.sleep(config.getBatchDelayMs());
            }
            List<MessageRef> batch = fresh.subList(batchIndex * batchSize, Math.min(fresh.size(), (batchIndex + 1) * batchSize));
            log.debug("Processing batch {}/{} ({} messages)", batchIndex + 1, batchCount, batch.size());

            for (MessageRef ref : batch) {
                progress.fetched++;
                progress.highestUid = Math.max(progress.highestUid, ref.uid());
                try {
                    processMessage(lease, account, folderName, ref, progress);
                } catch (TransportException | RuntimeException e) {
                    progress.errors++;
                    if (errorClassifier.isThrottling(e)) {
                        log.warn("Throttled at UID {} in {}, pausing {}ms", ref.uid(), folderName, config.getThrottlePauseMs());
                        sleeper.sleep(config.getThrottlePauseMs());
                    } else {
                        log.warn("Failed to process UID {} in {}: {}", ref.uid(), folderName, e.getMessage());
                    }
                }
            }
        }
    }

    private void processMessage(ConnectionLease lease, EmailAccount account, String folderName,
                                MessageRef ref, Progress progress) throws TransportException {
        long accountId = account.getId();
        RawMessage raw = lease.connection().fetch(ref.uid());

        NormalizationResult normalized = normalizer.normalize(raw, folderName, accountId);
        if (!normalized.isSuccess()) {
            progress.errors++;
            return;
        }

        MailRecord record = normalized.record();
        UpsertResult upsert = upsertService.upsert(accountId, record, raw.flags());
        if (upsert.isInserted()) {
            progress.saved++;
            notifyInserted(account, record, progress);
        } else {
            progress.updated++;
        }
    }

    private void notifyInserted(EmailAccount account, MailRecord record, Progress progress) {
        try {
            NotifyResult result = notifier.notify(record, account.getId(), account.getUserId());
            if (!result.delivered()) {
                log.debug("Notification skipped for {}: {}", record.getProviderMessageId(), result.reason());
            }
        } catch (RuntimeException e) {
            progress.notificationFailures++;
            log.warn("Notification failed for {}: {}", record.getProviderMessageId(), e.getMessage());
        }
    }

    private void writeSyncLog(long accountId, FolderSyncResult result) {
        SyncLogEntry entry = SyncLogEntry.builder()
                .accountId(accountId)
                .folderName(result.getFolderName())
                .syncType(SYNC_TYPE)
                .emailsFetched(result.getFetched())
                .emailsSaved(result.getSaved())
                .emailsUpdated(result.getUpdated())
                .errorsCount(result.getErrors())
                .durationMs(result.getDurationMs())
                .errorDetails(truncate(result.getError()))
                .createdAt(Instant.now().toString())
                .build();
        try {
            syncLogMapper.insert(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to write sync log for account {} folder {}: {}", accountId, result.getFolderName(), e.getMessage());
        }
    }

    private String truncate(String message) {
        int max = properties.getSync().getErrorDetailMaxLength();
        if (message == null || message.length() <= max) {
            return message;
        }
        return message.substring(0, max);
    }
}
