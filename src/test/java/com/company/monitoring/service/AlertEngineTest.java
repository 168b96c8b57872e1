package com.company.monitoring.service;

import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.enums.AlertType;
import com.company.monitoring.domain.enums.FetchErrorType;
import com.company.monitoring.repository.MonitoringSettingsRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final String HEADER_ID = "h-1";

    private MonitoredItemRegistry registry;
    private MeterRegistry meterRegistry;
    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new MonitoredItemRegistry();
        HealthStatusTracker healthTracker = new HealthStatusTracker(Clock.fixed(T0, ZoneOffset.UTC));
        MonitoringConfigManager configManager = new MonitoringConfigManager(
                mock(MonitoringSettingsRepository.class),
                new ObjectMapper(),
                mock(ApplicationEventPublisher.class),
                healthTracker,
                meterRegistry);
        engine = new AlertEngine(registry, configManager, meterRegistry);

        registry.put(MonitoredItem.builder()
                .headerId(HEADER_ID)
                .headerName("Casing Pressure A1")
                .projectId("p-1")
                .companyId("c-1")
                .stageId("s-1")
                .category("pressure")
                .build());
    }

    private List<AlertEvent> observe(Object value, long offsetMs) {
        return engine.evaluate(FetchResult.success(HEADER_ID, value, T0.plusMillis(offsetMs), 1), T0.plusMillis(offsetMs));
    }

    private List<AlertEvent> ofType(List<AlertEvent> alerts, AlertType type) {
        List<AlertEvent> matching = new ArrayList<>();
        for (AlertEvent alert : alerts) {
            if (alert.getType() == type) {
                matching.add(alert);
            }
        }
        return matching;
    }

    @Nested
    @DisplayName("Threshold alerts")
    class Threshold {

        @Test
        @DisplayName("Casing pressure scenario fires at the first tick past the alert duration")
        void casingPressureScenario() {
            assertThat(ofType(observe(15.0, 0), AlertType.THRESHOLD)).isEmpty();
            assertThat(ofType(observe(14.0, 20_000), AlertType.THRESHOLD)).isEmpty();

            List<AlertEvent> alerts = ofType(observe(13.0, 40_000), AlertType.THRESHOLD);

            assertThat(alerts).hasSize(1);
            AlertEvent alert = alerts.get(0);
            assertThat(alert.getHeaderId()).isEqualTo(HEADER_ID);
            assertThat(alert.getValue()).isEqualTo(13.0);
            assertThat(alert.getThreshold()).isEqualTo(20.0);
            assertThat(alert.getCompanyId()).isEqualTo("c-1");
            assertThat(alert.getStageId()).isEqualTo("s-1");
            assertThat(alert.getTimestamp()).isEqualTo(T0.plusMillis(40_000));
            assertThat(alert.getMessage()).contains("Casing Pressure A1").contains("20s");
        }

        @Test
        @DisplayName("Values never below threshold never raise a threshold alert")
        void neverBelowThreshold() {
            for (int i = 0; i < 20; i++) {
                assertThat(ofType(observe(25.0 + i, i * 10_000L), AlertType.THRESHOLD)).isEmpty();
            }
            assertThat(meterRegistry.find("monitoring.alerts.raised").tag("type", "threshold").counter()).isNull();
        }

        @Test
        @DisplayName("No alert before the window elapses, exactly one at or after it")
        void firesOnlyAfterAlertDuration() {
            observe(25.0, 0);
            observe(10.0, 5_000);
            assertThat(ofType(observe(10.0, 15_000), AlertType.THRESHOLD)).isEmpty();
            assertThat(ofType(observe(10.0, 24_999), AlertType.THRESHOLD)).isEmpty();
            assertThat(ofType(observe(10.0, 25_000), AlertType.THRESHOLD)).hasSize(1);
        }

        @Test
        @DisplayName("Latched mode reports one alert per episode")
        void latchedReportsOncePerEpisode() {
            observe(25.0, 0);
            observe(10.0, 10_000);
            assertThat(ofType(observe(10.0, 30_000), AlertType.THRESHOLD)).hasSize(1);
            assertThat(ofType(observe(11.0, 40_000), AlertType.THRESHOLD)).isEmpty();
            assertThat(ofType(observe(12.0, 50_000), AlertType.THRESHOLD)).isEmpty();
        }

        @Test
        @DisplayName("Repeat mode reports every evaluation while below threshold")
        void repeatModeReportsEveryTick() {
            ReflectionTestUtils.setField(engine, "repeatMode", "REPEAT");
            observe(25.0, 0);
            observe(10.0, 10_000);
            assertThat(ofType(observe(10.0, 30_000), AlertType.THRESHOLD)).hasSize(1);
            assertThat(ofType(observe(11.0, 40_000), AlertType.THRESHOLD)).hasSize(1);
            assertThat(registry.alertTimer(HEADER_ID).get().getStartTime()).isEqualTo(T0.plusMillis(10_000));
        }

        @Test
        @DisplayName("Recovery restarts the debounce window from the next drop")
        void recoveryRestartsWindow() {
            observe(25.0, 0);
            observe(10.0, 10_000);
            assertThat(ofType(observe(10.0, 30_000), AlertType.THRESHOLD)).hasSize(1);

            assertThat(ofType(observe(30.0, 40_000), AlertType.THRESHOLD)).isEmpty();
            assertThat(registry.alertTimer(HEADER_ID).get().isActive()).isFalse();

            // Drop again at t3 = 50s: window starts there, not at the first drop
            assertThat(ofType(observe(10.0, 50_000), AlertType.THRESHOLD)).isEmpty();
            assertThat(ofType(observe(10.0, 69_999), AlertType.THRESHOLD)).isEmpty();
            assertThat(ofType(observe(10.0, 70_000), AlertType.THRESHOLD)).hasSize(1);
        }

        @Test
        @DisplayName("Value equal to threshold counts as recovered")
        void equalToThresholdIsNotBelow() {
            observe(25.0, 0);
            observe(20.0, 10_000);
            assertThat(registry.alertTimer(HEADER_ID).get().isActive()).isFalse();
        }

        @Test
        @DisplayName("Non-numeric values skip threshold evaluation")
        void nonNumericSkipsThreshold() {
            observe("offline", 0);
            observe("offline", 30_000);
            assertThat(registry.alertTimer(HEADER_ID)).isEmpty();
        }

        @Test
        @DisplayName("Header override threshold takes precedence over category default")
        void overrideThresholdApplies() {
            registry.put(registry.find(HEADER_ID).get().toBuilder().threshold(5.0).build());
            observe(15.0, 0);
            observe(10.0, 10_000);
            assertThat(ofType(observe(10.0, 40_000), AlertType.THRESHOLD)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Frozen data alerts")
    class Frozen {

        @Test
        @DisplayName("Identical values fire once elapsed since first observation reaches the frozen threshold")
        void firesAfterFrozenThreshold() {
            long delta = 30_000;
            for (int i = 0; i < 4; i++) {
                assertThat(ofType(observe(42.0, i * delta), AlertType.FROZEN)).isEmpty();
            }
            List<AlertEvent> alerts = ofType(observe(42.0, 4 * delta), AlertType.FROZEN);

            assertThat(alerts).hasSize(1);
            assertThat(alerts.get(0).getMessage()).contains("2m 0s");
        }

        @Test
        @DisplayName("A single differing value resets the window")
        void changeResetsWindow() {
            observe(42.0, 0);
            observe(42.0, 100_000);
            observe(43.0, 110_000);
            assertThat(ofType(observe(43.0, 200_000), AlertType.FROZEN)).isEmpty();
            assertThat(ofType(observe(43.0, 230_000), AlertType.FROZEN)).hasSize(1);
        }

        @Test
        @DisplayName("Frozen emission does not move the last change time")
        void emissionKeepsLastChangeTime() {
            ReflectionTestUtils.setField(engine, "repeatMode", "REPEAT");
            observe(42.0, 0);
            assertThat(ofType(observe(42.0, 120_000), AlertType.FROZEN)).hasSize(1);
            assertThat(ofType(observe(42.0, 180_000), AlertType.FROZEN)).hasSize(1);
            assertThat(registry.frozenState(HEADER_ID).get().getLastChangeTime()).isEqualTo(T0);
        }

        @Test
        @DisplayName("After a restart the window resumes from the last value change, not the last read")
        void restartResumesFromLastChange() {
            observe(42.0, 0);
            observe(42.0, 30_000);
            observe(42.0, 60_000);

            registry.clearAlertStates();

            assertThat(ofType(observe(42.0, 90_000), AlertType.FROZEN)).isEmpty();
            assertThat(registry.frozenState(HEADER_ID).get().getLastChangeTime()).isEqualTo(T0);
            assertThat(ofType(observe(42.0, 120_000), AlertType.FROZEN)).hasSize(1);
        }

        @Test
        @DisplayName("A changed value after a restart starts a new window")
        void restartWithChangedValue() {
            observe(42.0, 0);
            registry.clearAlertStates();

            observe(43.0, 90_000);

            assertThat(registry.frozenState(HEADER_ID).get().getLastChangeTime()).isEqualTo(T0.plusMillis(90_000));
            assertThat(registry.lastValue(HEADER_ID).get().getChangedAt()).isEqualTo(T0.plusMillis(90_000));
        }

        @Test
        @DisplayName("Consecutive nulls count as unchanged")
        void nullsAreTrackedForContinuity() {
            FetchResult empty = FetchResult.failure(HEADER_ID, FetchErrorType.NO_CONTENT, "Empty response body", T0);
            engine.evaluate(empty, T0);
            List<AlertEvent> alerts = engine.evaluate(empty, T0.plusMillis(120_000));

            assertThat(ofType(alerts, AlertType.FROZEN)).hasSize(1);
            assertThat(ofType(alerts, AlertType.ERROR)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fetch errors and registry membership")
    class ErrorsAndMembership {

        @Test
        @DisplayName("Unmonitored headers never accumulate state")
        void unmonitoredHeaderSkipped() {
            List<AlertEvent> alerts = engine.evaluate(FetchResult.success("unknown", 1.0, T0, 1), T0);

            assertThat(alerts).isEmpty();
            assertThat(registry.alertTimer("unknown")).isEmpty();
            assertThat(registry.frozenState("unknown")).isEmpty();
        }

        @Test
        @DisplayName("One error event per error streak in latched mode")
        void errorStreakReportedOnce() {
            FetchResult failed = FetchResult.failure(HEADER_ID, FetchErrorType.HTTP_STATUS, "API error 500", T0);

            assertThat(ofType(engine.evaluate(failed, T0), AlertType.ERROR)).hasSize(1);
            assertThat(engine.evaluate(failed, T0.plusMillis(60_000))).isEmpty();

            observe(30.0, 120_000);
            assertThat(ofType(engine.evaluate(failed, T0.plusMillis(180_000)), AlertType.ERROR)).hasSize(1);
        }

        @Test
        @DisplayName("Errors leave threshold and frozen state untouched")
        void errorsSkipEvaluation() {
            observe(10.0, 0);
            engine.evaluate(FetchResult.failure(HEADER_ID, FetchErrorType.TIMEOUT, "timed out", T0), T0.plusMillis(10_000));

            assertThat(registry.alertTimer(HEADER_ID).get().isActive()).isFalse();
            assertThat(registry.frozenState(HEADER_ID).get().getLastObservedAt()).isEqualTo(T0);
        }
    }
}
