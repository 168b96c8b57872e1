package com.company.monitoring.service;

import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.domain.enums.SchedulerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class HealthStatusTrackerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private HealthStatusTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new HealthStatusTracker(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Starts healthy and idle")
    void initialState() {
        HealthStatus status = tracker.snapshot();

        assertThat(status.isHealthy()).isTrue();
        assertThat(status.getStartedAt()).isEqualTo(NOW);
        assertThat(status.getSchedulerState()).isEqualTo(SchedulerState.IDLE);
        assertThat(status.getConsecutiveErrorCount()).isZero();
    }

    @Test
    @DisplayName("Third consecutive failure marks unhealthy")
    void consecutiveFailures() {
        tracker.recordCycleFailure("store down");
        tracker.recordCycleFailure("store down");
        assertThat(tracker.snapshot().isHealthy()).isTrue();

        tracker.recordCycleFailure("store down");

        HealthStatus status = tracker.snapshot();
        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getConsecutiveErrorCount()).isEqualTo(3);
        assertThat(status.getLastError()).isEqualTo("3 consecutive monitoring errors: store down");
    }

    @Test
    @DisplayName("A successful cycle resets the error count and restores health")
    void successResets() {
        for (int i = 0; i < 3; i++) {
            tracker.recordCycleFailure("timeout");
        }

        Instant at = NOW.plusSeconds(60);
        tracker.recordCycleSuccess(at);

        HealthStatus status = tracker.snapshot();
        assertThat(status.isHealthy()).isTrue();
        assertThat(status.getConsecutiveErrorCount()).isZero();
        assertThat(status.getLastSuccessAt()).isEqualTo(at);
    }

    @Test
    @DisplayName("Success does not restore health while the config is broken")
    void configFailureKeepsUnhealthy() {
        tracker.recordConfigLoad(false, "invalid JSON");
        tracker.recordCycleSuccess(NOW);

        HealthStatus status = tracker.snapshot();
        assertThat(status.isConfigOk()).isFalse();
        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getLastError()).isEqualTo("Configuration load failed: invalid JSON");
    }

    @Test
    @DisplayName("Cycle success does not restore health while the store is unavailable")
    void storeFailureKeepsUnhealthy() {
        tracker.recordStoreStatus(false, "connection refused");
        tracker.recordCycleSuccess(NOW);

        HealthStatus status = tracker.snapshot();
        assertThat(status.isStoreOk()).isFalse();
        assertThat(status.isHealthy()).isFalse();
        assertThat(status.getLastError()).isEqualTo("Store unavailable: connection refused");

        tracker.recordStoreStatus(true, null);
        tracker.recordCycleSuccess(NOW.plusSeconds(60));

        assertThat(tracker.snapshot().isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Scheduler state and item count are reflected in the snapshot")
    void schedulerStateAndCount() {
        tracker.recordSchedulerState(SchedulerState.RUNNING);
        tracker.recordMonitoredItemCount(42);

        assertThat(tracker.snapshot().getSchedulerState()).isEqualTo(SchedulerState.RUNNING);
        assertThat(tracker.snapshot().getMonitoredItemCount()).isEqualTo(42);
    }
}
