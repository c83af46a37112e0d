package com.mailsync.service;

import com.mailsync.domain.EmailAccount;
import com.mailsync.domain.SyncStatus;
import com.mailsync.error.ErrorClassifier;
import com.mailsync.error.ErrorKind;
import com.mailsync.mapper.EmailAccountMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Sync cycle over all active accounts
 * - Accounts, then folders, then batches, strictly sequential
 * - Accounts held by a realtime IDLE session are skipped
 * - Account status / error message persisted after every outcome
 * - Pooled connection always released: kept on success, disposed otherwise
 */
@Slf4j
@Service
public class AccountSyncOrchestrator {

    private final EmailAccountMapper accountMapper;
    private final CursorService cursorService;
    private final FolderSyncEngine folderSyncEngine;
    private final ConnectionPool connectionPool;
    private final RealtimeCoordinator realtimeCoordinator;
    private final ErrorClassifier errorClassifier;

    private final Counter savedCounter;
    private final Counter updatedCounter;
    private final Counter errorCounter;
    private final Counter notificationFailureCounter;
    private final Counter accountFailureCounter;
    private final Timer cycleTimer;

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public AccountSyncOrchestrator(EmailAccountMapper accountMapper,
                                   CursorService cursorService,
                                   FolderSyncEngine folderSyncEngine,
                                   ConnectionPool connectionPool,
                                   RealtimeCoordinator realtimeCoordinator,
                                   ErrorClassifier errorClassifier,
                                   MeterRegistry meterRegistry) {
        this.accountMapper = accountMapper;
        this.cursorService = cursorService;
        this.folderSyncEngine = folderSyncEngine;
        this.connectionPool = connectionPool;
        this.realtimeCoordinator = realtimeCoordinator;
        this.errorClassifier = errorClassifier;
        this.savedCounter = Counter.builder("mailsync.messages.saved")
                .description("New messages stored")
                .register(meterRegistry);
        this.updatedCounter = Counter.builder("mailsync.messages.updated")
                .description("Re-observed messages updated")
                .register(meterRegistry);
        this.errorCounter = Counter.builder("mailsync.messages.errors")
                .description("Per-message and per-folder sync errors")
                .register(meterRegistry);
        this.notificationFailureCounter = Counter.builder("mailsync.notifications.failed")
                .description("Notification attempts that failed")
                .register(meterRegistry);
        this.accountFailureCounter = Counter.builder("mailsync.accounts.failed")
                .description("Account syncs that ended in error or throttling")
                .register(meterRegistry);
        this.cycleTimer = Timer.builder("mailsync.cycle.duration")
                .description("Duration of a full sync cycle")
                .register(meterRegistry);
    }

    /**
     * One pass over all active accounts. Never throws.
     */
    public CycleSummary runCycle() {
        long startedAt = System.currentTimeMillis();
        List<EmailAccount> accounts;
        try {
            accounts = accountMapper.findActive();
        } catch (RuntimeException e) {
            log.error("Cannot list accounts, sync cycle aborted", e);
            return new CycleSummary(0, 0, 0, 0, 0, 0, 0, System.currentTimeMillis() - startedAt);
        }

        log.info("Sync cycle started: {} active accounts", accounts.size());
        int synced = 0, skipped = 0, failed = 0, saved = 0, updated = 0, errors = 0;
        for (EmailAccount account : accounts) {
            if (!account.hasImapSettings()) {
                log.warn("Account {} has no IMAP settings, skipping", account.getId());
                skipped++;
                continue;
            }
            try {
                AccountSyncResult result = syncAccount(account.getId());
                switch (result.getOutcome()) {
                    case SYNCED -> synced++;
                    case SKIPPED -> skipped++;
                    default -> failed++;
                }
                saved += result.getSaved();
                updated += result.getUpdated();
                errors += result.getErrors();
            } catch (RuntimeException e) {
                log.error("Unexpected failure syncing account {}", account.getId(), e);
                failed++;
            }
        }

        long duration = System.currentTimeMillis() - startedAt;
        cycleTimer.record(duration, TimeUnit.MILLISECONDS);
        CycleSummary summary = new CycleSummary(accounts.size(), synced, skipped, failed, saved, updated, errors, duration);
        log.info("Sync cycle finished: {}", summary);
        return summary;
    }

    /**
     * Sync one account now
     */
    public AccountSyncResult syncAccount(long accountId) {
        EmailAccount account = accountMapper.findActiveById(accountId);
        if (account == null) {
            log.debug("Account {} vanished or deactivated, skipping", accountId);
            return AccountSyncResult.skipped(accountId, "account_not_found");
        }
        if (!account.hasImapSettings()) {
            log.warn("Account {} has no IMAP settings, skipping", accountId);
            return AccountSyncResult.skipped(accountId, "missing_imap_settings");
        }
        if (realtimeCoordinator.isRealtimeActive(accountId)) {
            log.debug("Account {} is held by a realtime session, skipping", accountId);
            return AccountSyncResult.skipped(accountId, "realtime_active");
        }
        if (!inFlight.add(accountId)) {
            log.debug("Account {} is already syncing, skipping", accountId);
            return AccountSyncResult.skipped(accountId, "sync_in_progress");
        }
        try {
            return doSync(account);
        } finally {
            inFlight.remove(accountId);
        }
    }

    private AccountSyncResult doSync(EmailAccount account) {
        long accountId = account.getId();
        accountMapper.updateSyncStatus(accountId, SyncStatus.SYNCING);
        if (account.getNeedsReconnection() == 1) {
            log.info("Account {} flagged for reconnection, dropping pooled connection", accountId);
            connectionPool.evict(accountId);
        }

        ConnectionLease lease = connectionPool.lease(account);
        boolean dispose = true;
        AccountSyncResult result;
        AccountSyncResult.AccountSyncResultBuilder builder = AccountSyncResult.builder().accountId(accountId);
        try {
            for (String folderName : cursorService.eligibleFolders(accountId)) {
                builder.folder(folderSyncEngine.syncFolder(lease, account, folderName));
            }
            result = complete(account, builder.build());
            dispose = result.getOutcome() != AccountSyncResult.Outcome.SYNCED;
        } catch (RuntimeException e) {
            result = fail(account, e, builder.build().getFolders());
        } finally {
            connectionPool.release(lease, dispose);
        }
        record(result);
        return result;
    }

    private AccountSyncResult complete(EmailAccount account, AccountSyncResult partial) {
        long accountId = account.getId();
        String now = Instant.now().toString();
        List<FolderSyncResult> folders = partial.getFolders();

        List<FolderSyncResult> authFailed = folders.stream().filter(FolderSyncResult::isAuthFailed).toList();
        if (!authFailed.isEmpty()) {
            String details = "Authentication failed for " + folderNames(authFailed) + ", reconnection required";
            accountMapper.markSyncFailed(accountId, SyncStatus.ERROR, details, authFailed.get(0).getError(), now);
            log.error("Account {} needs reconnection: {}", accountId, details);
            return withOutcome(partial, AccountSyncResult.Outcome.NEEDS_RECONNECTION, details);
        }

        List<FolderSyncResult> throttled = folders.stream().filter(FolderSyncResult::isThrottled).toList();
        if (!throttled.isEmpty()) {
            String details = "Temporarily throttled by the mail provider on " + folderNames(throttled)
                    + ", will retry automatically";
            accountMapper.markSyncFailed(accountId, SyncStatus.THROTTLED, details, throttled.get(0).getError(), now);
            log.warn("Account {} throttled: {}", accountId, details);
            return withOutcome(partial, AccountSyncResult.Outcome.THROTTLED, details);
        }

        List<FolderSyncResult> failed = folders.stream().filter(f -> f.getError() != null).toList();
        String details = failed.isEmpty() ? null : failed.stream()
                .map(f -> f.getFolderName() + ": " + f.getError())
                .collect(Collectors.joining("; "));
        accountMapper.markSyncSucceeded(accountId, SyncStatus.IDLE, details, now);
        if (accountMapper.markInitialSyncCompleted(accountId, now) == 1) {
            log.info("Initial sync completed for account {}, notifications enabled from {}", accountId, now);
        }
        log.info("Account {} synced: fetched={}, saved={}, updated={}, errors={}",
                accountId, partial.getFetched(), partial.getSaved(), partial.getUpdated(), partial.getErrors());
        return withOutcome(partial, AccountSyncResult.Outcome.SYNCED, details);
    }

    /**
     * Folders finished before the failure are kept so their stored messages are still counted
     */
    private AccountSyncResult fail(EmailAccount account, RuntimeException e, List<FolderSyncResult> finished) {
        long accountId = account.getId();
        String now = Instant.now().toString();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        ErrorKind kind = errorClassifier.classify(e);
        AccountSyncResult.Outcome outcome;
        try {
            switch (kind) {
                case AUTHENTICATION -> {
                    accountMapper.markNeedsReconnection(accountId, message, now);
                    accountMapper.markSyncFailed(accountId, SyncStatus.ERROR,
                            "Authentication failed, reconnection required", message, now);
                    outcome = AccountSyncResult.Outcome.NEEDS_RECONNECTION;
                    log.error("Account {} authentication failed: {}", accountId, message);
                }
                case THROTTLED, CONNECTION_DROPPED -> {
                    accountMapper.markSyncFailed(accountId, SyncStatus.THROTTLED,
                            "Temporarily throttled by the mail provider, will retry automatically", message, now);
                    outcome = AccountSyncResult.Outcome.THROTTLED;
                    log.warn("Account {} throttled or dropped: {}", accountId, message);
                }
                default -> {
                    accountMapper.markSyncFailed(accountId, SyncStatus.ERROR, message, message, now);
                    outcome = AccountSyncResult.Outcome.FAILED;
                    log.error("Account {} sync failed", accountId, e);
                }
            }
        } catch (RuntimeException statusError) {
            log.error("Failed to record sync failure for account {}", accountId, statusError);
            outcome = AccountSyncResult.Outcome.FAILED;
        }
        return AccountSyncResult.builder()
                .accountId(accountId)
                .outcome(outcome)
                .message(message)
                .folders(finished)
                .build();
    }

    private void record(AccountSyncResult result) {
        savedCounter.increment(result.getSaved());
        updatedCounter.increment(result.getUpdated());
        errorCounter.increment(result.getErrors());
        notificationFailureCounter.increment(result.getFolders().stream()
                .mapToInt(FolderSyncResult::getNotificationFailures).sum());
        if (result.getOutcome() != AccountSyncResult.Outcome.SYNCED
                && result.getOutcome() != AccountSyncResult.Outcome.SKIPPED) {
            accountFailureCounter.increment();
        }
    }

    private static AccountSyncResult withOutcome(AccountSyncResult partial, AccountSyncResult.Outcome outcome, String message) {
        return AccountSyncResult.builder()
                .accountId(partial.getAccountId())
                .outcome(outcome)
                .message(message)
                .folders(partial.getFolders())
                .build();
    }

    private static String folderNames(List<FolderSyncResult> results) {
        return results.stream().map(FolderSyncResult::getFolderName).collect(Collectors.joining(", "));
    }
}
