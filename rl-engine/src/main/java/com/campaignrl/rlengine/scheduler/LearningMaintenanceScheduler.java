package com.campaignrl.rlengine.scheduler;

import com.campaignrl.rlengine.service.LearningOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Two independent maintenance loops:
 * <pre>
 *   delay(auto-save-interval)       → save strategies + Q-table       → repeat
 *   delay(history-cleanup-interval) → delete history older than retention → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the next one.
 * Failures are logged and the loop reschedules with the same interval; it never stops
 * until the application shuts down.
 */
@Component
public class LearningMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(LearningMaintenanceScheduler.class);

    private final LearningOrchestrator orchestrator;
    private final Duration autoSaveInterval;
    private final Duration historyCleanupInterval;
    private volatile boolean running;

    public LearningMaintenanceScheduler(
            LearningOrchestrator orchestrator,
            @Value("${rl.maintenance.auto-save-interval:PT3M}") Duration autoSaveInterval,
            @Value("${rl.maintenance.history-cleanup-interval:PT30M}") Duration historyCleanupInterval) {
        this.orchestrator           = orchestrator;
        this.autoSaveInterval       = autoSaveInterval;
        this.historyCleanupInterval = historyCleanupInterval;
    }

    @PostConstruct
    public void start() {
        running = true;
        log.info("[Maintenance] Loops started. autoSaveIntervalSeconds={} historyCleanupIntervalSeconds={}",
                 autoSaveInterval.toSeconds(), historyCleanupInterval.toSeconds());
        scheduleNext("auto-save", autoSaveInterval, () -> orchestrator.saveAll().thenReturn(0L));
        scheduleNext("history-cleanup", historyCleanupInterval, orchestrator::cleanupHistory);
    }

    @PreDestroy
    public void stop() {
        running = false;
    }

    private void scheduleNext(String task, Duration interval, Supplier<Mono<Long>> work) {
        if (!running) {
            return;
        }
        Mono.delay(interval)
            .then(Mono.defer(work))
            .subscribe(
                affected -> log.debug("[Maintenance] {} completed. affected={}", task, affected),
                err -> {
                    log.warn("[Maintenance] {} failed, rescheduling. intervalSeconds={}",
                             task, interval.toSeconds(), err);
                    scheduleNext(task, interval, work);
                },
                () -> scheduleNext(task, interval, work)
            );
    }
}
