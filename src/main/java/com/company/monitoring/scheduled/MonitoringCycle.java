package com.company.monitoring.scheduled;

import com.company.monitoring.client.TelemetryClient;
import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.CycleResult;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.MonitoringConfig;
import com.company.monitoring.domain.SyncResult;
import com.company.monitoring.domain.enums.FetchErrorType;
import com.company.monitoring.event.AlertsRaisedEvent;
import com.company.monitoring.exception.CycleExecutionException;
import com.company.monitoring.service.AlertEngine;
import com.company.monitoring.service.DuplicateHeaderCleanupService;
import com.company.monitoring.service.HealthStatusTracker;
import com.company.monitoring.service.MonitoredItemRegistry;
import com.company.monitoring.service.MonitoringConfigManager;
import com.company.monitoring.service.RegistryReconciler;
import com.company.monitoring.service.StageTransitionService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One pass over all monitored headers: sync, maintenance, fetch, evaluate, stage transitions,
 * notify. Alert state is only touched on the calling thread; fetches fan out on the fetch executor.
 */
@Component
@Slf4j
public class MonitoringCycle {

    private static final String MDC_CYCLE_ID_KEY = "cycleId";

    private final RegistryReconciler reconciler;
    private final MonitoredItemRegistry registry;
    private final AlertEngine alertEngine;
    private final TelemetryClient telemetryClient;
    private final StageTransitionService stageTransitionService;
    private final DuplicateHeaderCleanupService duplicateCleanupService;
    private final MonitoringConfigManager configManager;
    private final HealthStatusTracker healthTracker;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Executor fetchExecutor;
    private final Clock clock;

    @Value("${monitoring.telemetry.fetch-timeout-ms:10000}")
    private long fetchTimeoutMs = 10_000L;

    @Value("${monitoring.scheduler.prune-interval-ms:3600000}")
    private long pruneIntervalMs = 3_600_000L;

    @Value("${monitoring.scheduler.duplicate-cleanup-interval-ms:300000}")
    private long duplicateCleanupIntervalMs = 300_000L;

    @Value("${monitoring.state.max-age-ms:86400000}")
    private long stateMaxAgeMs = 86_400_000L;

    private Instant lastPruneAt;
    private Instant lastDuplicateCleanupAt;

    public MonitoringCycle(RegistryReconciler reconciler,
                           MonitoredItemRegistry registry,
                           AlertEngine alertEngine,
                           TelemetryClient telemetryClient,
                           StageTransitionService stageTransitionService,
                           DuplicateHeaderCleanupService duplicateCleanupService,
                           MonitoringConfigManager configManager,
                           HealthStatusTracker healthTracker,
                           ApplicationEventPublisher eventPublisher,
                           MeterRegistry meterRegistry,
                           @Qualifier("fetchExecutor") Executor fetchExecutor,
                           Clock clock) {
        this.reconciler = reconciler;
        this.registry = registry;
        this.alertEngine = alertEngine;
        this.telemetryClient = telemetryClient;
        this.stageTransitionService = stageTransitionService;
        this.duplicateCleanupService = duplicateCleanupService;
        this.configManager = configManager;
        this.healthTracker = healthTracker;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * @throws CycleExecutionException when the cycle body fails; the caller counts it as a cycle error
     */
    public CycleResult execute() {
        String cycleId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_CYCLE_ID_KEY, cycleId);
        Instant startedAt = clock.instant();

        try {
            healthTracker.recordCycleStart(startedAt);
            log.info("Starting monitoring cycle");

            SyncResult sync = reconciler.sync();
            if (!sync.isSuccess()) {
                log.warn("Registry sync failed, continuing with last known items: {}", sync.getError());
            }
            healthTracker.recordStoreStatus(sync.isSuccess(), sync.getError());

            runMaintenance(startedAt);

            List<MonitoredItem> items = registry.snapshot();
            List<FetchResult> results = fetchAll(items);
            int fetchErrors = (int) results.stream().filter(FetchResult::isError).count();

            List<AlertEvent> alerts = alertEngine.evaluateAll(results, clock.instant());

            try {
                stageTransitionService.detectTransitions();
            } catch (RuntimeException e) {
                log.error("Stage transition check failed", e);
            }

            registry.recordAlerts(alerts);
            MonitoringConfig config = configManager.current();
            if (!alerts.isEmpty() && config.getWebhookPolicy().isEnabled()) {
                eventPublisher.publishEvent(new AlertsRaisedEvent(cycleId, alerts));
            }

            Instant finishedAt = clock.instant();
            long durationMs = Duration.between(startedAt, finishedAt).toMillis();
            healthTracker.recordCycleSuccess(finishedAt);
            meterRegistry.timer("monitoring.cycle.duration").record(Duration.ofMillis(durationMs));
            meterRegistry.counter("monitoring.cycle.completed").increment();

            log.info("Monitoring cycle completed in {}ms: {} headers, {} fetch errors, {} alerts",
                    durationMs, items.size(), fetchErrors, alerts.size());

            return CycleResult.builder()
                    .headerCount(items.size())
                    .fetchErrors(fetchErrors)
                    .alerts(alerts)
                    .durationMs(durationMs)
                    .build();

        } catch (RuntimeException e) {
            meterRegistry.counter("monitoring.cycle.failed").increment();
            throw new CycleExecutionException("Monitoring cycle " + cycleId + " failed: " + e.getMessage(), e);
        } finally {
            MDC.remove(MDC_CYCLE_ID_KEY);
        }
    }

    private void runMaintenance(Instant now) {
        if (lastPruneAt == null || elapsedMs(lastPruneAt, now) >= pruneIntervalMs) {
            lastPruneAt = now;
            registry.pruneStates(now, Duration.ofMillis(stateMaxAgeMs));
        }
        if (lastDuplicateCleanupAt == null || elapsedMs(lastDuplicateCleanupAt, now) >= duplicateCleanupIntervalMs) {
            lastDuplicateCleanupAt = now;
            int removed = duplicateCleanupService.cleanupDuplicates();
            if (removed > 0) {
                // Pick up the unmonitored duplicates before fetching
                reconciler.sync();
            }
        }
    }

    List<FetchResult> fetchAll(List<MonitoredItem> items) {
        List<CompletableFuture<FetchResult>> futures = new ArrayList<>(items.size());
        for (MonitoredItem item : items) {
            String headerId = item.getHeaderId();
            futures.add(CompletableFuture
                    .supplyAsync(() -> telemetryClient.fetchValue(headerId), fetchExecutor)
                    .orTimeout(fetchTimeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> fetchFailure(headerId, e)));
        }

        List<FetchResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<FetchResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private FetchResult fetchFailure(String headerId, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            log.warn("Fetch for header {} timed out after {}ms", headerId, fetchTimeoutMs);
            meterRegistry.counter("monitoring.fetch.errors", "type", FetchErrorType.TIMEOUT.name()).increment();
            return FetchResult.failure(headerId, FetchErrorType.TIMEOUT,
                    "Timed out after " + fetchTimeoutMs + "ms", clock.instant());
        }
        log.warn("Fetch for header {} failed: {}", headerId, cause.getMessage());
        meterRegistry.counter("monitoring.fetch.errors", "type", FetchErrorType.NETWORK.name()).increment();
        return FetchResult.failure(headerId, FetchErrorType.NETWORK, String.valueOf(cause.getMessage()), clock.instant());
    }

    private static long elapsedMs(Instant from, Instant to) {
        return Duration.between(from, to).toMillis();
    }
}
