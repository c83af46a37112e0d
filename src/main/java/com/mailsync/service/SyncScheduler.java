package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Periodic driver for sync cycles
 * - Nothing runs until {@link #start()}; {@link #stop()} cancels the timer
 * - A tick that fires while a cycle is still running is dropped
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncScheduler implements SmartLifecycle {

    private final AccountSyncOrchestrator orchestrator;
    private final SyncProperties properties;

    private volatile Scheduler timer;
    private volatile Disposable subscription;
    private volatile CycleSummary lastSummary;

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        SyncProperties.Scheduler config = properties.getScheduler();
        timer = Schedulers.newSingle("mailsync-scheduler");
        subscription = Flux.interval(Duration.ofMillis(config.getInitialDelayMs()), Duration.ofMillis(config.getIntervalMs()), timer)
                .onBackpressureDrop(tick -> log.warn("Previous sync cycle still running, skipping tick {}", tick))
                .concatMap(tick -> Mono.fromCallable(orchestrator::runCycle)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.error("Sync cycle failed", e);
                            return Mono.empty();
                        }), 1)
                .subscribe(summary -> lastSummary = summary);
        log.info("Sync scheduler started: first cycle in {}ms, then every {}ms",
                config.getInitialDelayMs(), config.getIntervalMs());
    }

    @Override
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            timer.dispose();
            timer = null;
            log.info("Sync scheduler stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isEnabled();
    }

    public CycleSummary getLastSummary() {
        return lastSummary;
    }
}
