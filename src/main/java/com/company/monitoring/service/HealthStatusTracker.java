package com.company.monitoring.service;

import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.domain.enums.SchedulerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owner of the process-wide {@link HealthStatus}. Every mutation replaces the snapshot atomically,
 * so readers always see a consistent view.
 */
@Service
@Slf4j
public class HealthStatusTracker {

    private final Clock clock;
    private final AtomicReference<HealthStatus> status;

    @Value("${monitoring.health.max-consecutive-errors:3}")
    private int maxConsecutiveErrors = 3;

    public HealthStatusTracker(Clock clock) {
        this.clock = clock;
        this.status = new AtomicReference<>(HealthStatus.builder()
                .startedAt(clock.instant())
                .healthy(true)
                .storeOk(true)
                .apiOk(true)
                .configOk(true)
                .schedulerState(SchedulerState.IDLE)
                .build());
    }

    public HealthStatus snapshot() {
        return status.get();
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public void recordStartup() {
        update(s -> s.toBuilder().startedAt(clock.instant()).build());
    }

    public void recordCycleStart(Instant at) {
        update(s -> s.toBuilder().lastCycleAt(at).build());
    }

    public void recordCycleSuccess(Instant at) {
        update(s -> s.toBuilder()
                .lastSuccessAt(at)
                .consecutiveErrorCount(0)
                .healthy(s.isStoreOk() && s.isApiOk() && s.isConfigOk())
                .build());
    }

    /**
     * Counts a failed cycle; the limit-th consecutive failure marks the service unhealthy
     */
    public void recordCycleFailure(String error) {
        HealthStatus updated = update(s -> {
            int errors = s.getConsecutiveErrorCount() + 1;
            HealthStatus.HealthStatusBuilder builder = s.toBuilder().consecutiveErrorCount(errors);
            if (errors >= maxConsecutiveErrors) {
                builder.healthy(false)
                        .lastError(errors + " consecutive monitoring errors: " + error);
            }
            return builder.build();
        });
        if (!updated.isHealthy()) {
            log.error("Monitoring marked unhealthy after {} consecutive cycle failures", updated.getConsecutiveErrorCount());
        }
    }

    public void recordConfigLoad(boolean ok, String error) {
        update(s -> {
            HealthStatus.HealthStatusBuilder builder = s.toBuilder().configOk(ok);
            if (!ok) {
                builder.lastError("Configuration load failed: " + error);
            }
            return builder.build();
        });
    }

    /**
     * Store reachability as seen by the registry sync. A failure marks the service unhealthy
     * until a later sync or health check reaches the store again.
     */
    public void recordStoreStatus(boolean ok, String error) {
        update(s -> {
            HealthStatus.HealthStatusBuilder builder = s.toBuilder().storeOk(ok);
            if (!ok) {
                builder.healthy(false).lastError("Store unavailable: " + error);
            }
            return builder.build();
        });
    }

    public void recordSchedulerState(SchedulerState state) {
        update(s -> s.toBuilder().schedulerState(state).build());
    }

    public void recordMonitoredItemCount(int count) {
        update(s -> s.toBuilder().monitoredItemCount(count).build());
    }

    public HealthStatus update(UnaryOperator<HealthStatus> mutation) {
        return status.updateAndGet(mutation);
    }
}
