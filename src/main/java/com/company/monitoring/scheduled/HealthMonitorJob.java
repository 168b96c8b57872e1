package com.company.monitoring.scheduled;

import com.company.monitoring.client.TelemetryClient;
import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.repository.MonitoredHeaderRepository;
import com.company.monitoring.service.HealthStatusTracker;
import com.company.monitoring.service.MonitoredItemRegistry;
import com.company.monitoring.service.MonitoringConfigManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic health check, independent of the cycle scheduler: cycle staleness, store and API
 * checks, and registry drift against the store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthMonitorJob {

    private final HealthStatusTracker healthTracker;
    private final MonitoringConfigManager configManager;
    private final MonitoredHeaderRepository headerRepository;
    private final TelemetryClient telemetryClient;
    private final MonitoredItemRegistry registry;
    private final MonitoringCycleScheduler scheduler;
    private final Clock clock;

    @Value("${monitoring.health.drift-tolerance:5}")
    private int driftTolerance = 5;

    @Scheduled(
            fixedDelayString = "${monitoring.health.check-interval-ms:300000}",
            initialDelayString = "${monitoring.health.initial-delay-ms:300000}"
    )
    public void runHealthCheck() {
        checkHealth();
    }

    public HealthStatus checkHealth() {
        Instant now = clock.instant();
        HealthStatus before = healthTracker.snapshot();

        boolean cycleFresh = isCycleFresh(before, now);
        boolean storeOk = checkStore();
        boolean apiOk = checkApi();
        if (storeOk) {
            checkDrift();
        }

        HealthStatus after = healthTracker.update(s -> {
            boolean healthy = cycleFresh && storeOk && apiOk && s.isConfigOk()
                    && s.getConsecutiveErrorCount() < healthTracker.getMaxConsecutiveErrors();
            HealthStatus.HealthStatusBuilder builder = s.toBuilder()
                    .lastHealthCheckAt(now)
                    .storeOk(storeOk)
                    .apiOk(apiOk)
                    .healthy(healthy);
            if (!healthy) {
                builder.lastError(describeFailure(cycleFresh, storeOk, apiOk, s));
            }
            return builder.build();
        });

        if (!after.isHealthy()) {
            log.warn("Health check failed: {}", after.getLastError());
        } else if (!before.isHealthy()) {
            log.info("Monitoring recovered, all health checks pass");
        } else {
            log.debug("Health check passed");
        }
        return after;
    }

    /**
     * A scheduler that is not started has nothing to be stale about
     */
    private boolean isCycleFresh(HealthStatus status, Instant now) {
        if (!scheduler.isStarted()) {
            return true;
        }
        Instant reference = status.getLastCycleAt() != null ? status.getLastCycleAt() : status.getStartedAt();
        long maxAgeMs = 2 * configManager.current().getPollingIntervalMs();
        long ageMs = Duration.between(reference, now).toMillis();
        if (ageMs > maxAgeMs) {
            log.warn("Last monitoring cycle ran {}ms ago, more than twice the polling interval", ageMs);
            return false;
        }
        return true;
    }

    private boolean checkStore() {
        try {
            return headerRepository.ping();
        } catch (DataAccessException e) {
            log.warn("Store check failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean checkApi() {
        return telemetryClient.ping();
    }

    /**
     * Drift is resolved by an immediate cycle, whose sync runs on the cycle thread like any other
     * registry mutation. A stopped scheduler resyncs on its next start.
     */
    private void checkDrift() {
        int storeCount;
        try {
            storeCount = headerRepository.countMonitored();
        } catch (DataAccessException e) {
            log.warn("Drift check failed: {}", e.getMessage());
            return;
        }
        int memoryCount = registry.size();
        if (Math.abs(storeCount - memoryCount) <= driftTolerance) {
            return;
        }
        if (!scheduler.isStarted()) {
            log.warn("Monitored item drift: {} in memory, {} in store, scheduler stopped", memoryCount, storeCount);
            return;
        }
        log.warn("Monitored item drift: {} in memory, {} in store, triggering a cycle to resync", memoryCount, storeCount);
        if (scheduler.triggerCycle() == null) {
            log.info("Cycle already in progress, its sync resolves the drift");
        }
    }

    private static String describeFailure(boolean cycleFresh, boolean storeOk, boolean apiOk, HealthStatus s) {
        if (!cycleFresh) {
            return "Monitoring cycles have stopped";
        }
        if (!storeOk) {
            return "Store connectivity check failed";
        }
        if (!apiOk) {
            return "Telemetry API connectivity check failed";
        }
        return s.getLastError();
    }
}
