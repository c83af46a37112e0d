package com.mailsync.controller;

import com.mailsync.service.AccountSyncOrchestrator;
import com.mailsync.service.AccountSyncResult;
import com.mailsync.service.ConnectionPool;
import com.mailsync.service.CycleSummary;
import com.mailsync.service.RealtimeSessionRegistry;
import com.mailsync.service.SyncScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sync operations endpoint
 * - GET /api/sync/status: pool and scheduler state
 * - POST /api/sync/accounts/{id}: fetch new mail for one account now
 * - POST /api/sync/cycle: run a full cycle now
 */
@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final AccountSyncOrchestrator orchestrator;
    private final ConnectionPool connectionPool;
    private final RealtimeSessionRegistry realtimeRegistry;
    private final SyncScheduler scheduler;

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> status() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("schedulerRunning", scheduler.isRunning());
        result.put("lastCycle", scheduler.getLastSummary());
        result.put("pool", connectionPool.stats());
        result.put("realtimeSessions", realtimeRegistry.activeCount());
        return result;
    }

    @PostMapping(value = "/accounts/{accountId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AccountSyncResult> syncAccount(@PathVariable("accountId") long accountId) {
        log.info("Manual sync requested for account {}", accountId);
        AccountSyncResult result = orchestrator.syncAccount(accountId);
        if (result.getOutcome() == AccountSyncResult.Outcome.SKIPPED && "account_not_found".equals(result.getMessage())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping(value = "/cycle", produces = MediaType.APPLICATION_JSON_VALUE)
    public CycleSummary runCycle() {
        log.info("Manual sync cycle requested");
        return orchestrator.runCycle();
    }
}
