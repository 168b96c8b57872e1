package com.company.monitoring.scheduled;

import com.company.monitoring.client.TelemetryClient;
import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.CycleResult;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.MonitoringConfig;
import com.company.monitoring.domain.MonitoringConfig.WebhookPolicy;
import com.company.monitoring.domain.SyncResult;
import com.company.monitoring.domain.enums.AlertType;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonitoringCycleTest {

    @Mock
    private RegistryReconciler reconciler;

    @Mock
    private MonitoredItemRegistry registry;

    @Mock
    private AlertEngine alertEngine;

    @Mock
    private TelemetryClient telemetryClient;

    @Mock
    private StageTransitionService stageTransitionService;

    @Mock
    private DuplicateHeaderCleanupService duplicateCleanupService;

    @Mock
    private MonitoringConfigManager configManager;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService fetchExecutor;
    private SimpleMeterRegistry meterRegistry;
    private HealthStatusTracker healthTracker;
    private MonitoringCycle cycle;

    @BeforeEach
    void setUp() {
        fetchExecutor = Executors.newFixedThreadPool(2);
        meterRegistry = new SimpleMeterRegistry();
        healthTracker = new HealthStatusTracker(Clock.systemUTC());
        cycle = new MonitoringCycle(reconciler, registry, alertEngine, telemetryClient, stageTransitionService,
                duplicateCleanupService, configManager, healthTracker, eventPublisher, meterRegistry,
                fetchExecutor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        fetchExecutor.shutdownNow();
    }

    private static MonitoredItem item(String headerId) {
        return MonitoredItem.builder().headerId(headerId).headerName(headerId).build();
    }

    private static AlertEvent alert() {
        return AlertEvent.builder().headerId("h-1").type(AlertType.THRESHOLD).timestamp(Instant.now()).build();
    }

    @Test
    @DisplayName("A fetch that exceeds the timeout becomes a TIMEOUT result")
    @SuppressWarnings("unchecked")
    void fetchTimeout() {
        ReflectionTestUtils.setField(cycle, "fetchTimeoutMs", 100L);
        when(reconciler.sync()).thenReturn(SyncResult.success(null));
        when(registry.snapshot()).thenReturn(List.of(item("h-1"), item("h-2")));
        when(telemetryClient.fetchValue("h-1")).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return FetchResult.success("h-1", 1.0, Instant.now(), 1);
        });
        when(telemetryClient.fetchValue("h-2")).thenReturn(FetchResult.success("h-2", 25.0, Instant.now(), 1));
        when(alertEngine.evaluateAll(anyCollection(), any(Instant.class))).thenReturn(List.of());
        when(configManager.current()).thenReturn(MonitoringConfig.defaults());

        CycleResult result = cycle.execute();

        ArgumentCaptor<Collection<FetchResult>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(alertEngine).evaluateAll(captor.capture(), any(Instant.class));
        assertThat(captor.getValue())
                .extracting(FetchResult::getHeaderId, FetchResult::getErrorType)
                .containsExactly(
                        tuple("h-1", FetchErrorType.TIMEOUT),
                        tuple("h-2", null));
        assertThat(result.getHeaderCount()).isEqualTo(2);
        assertThat(result.getFetchErrors()).isEqualTo(1);
        assertThat(healthTracker.snapshot().getLastSuccessAt()).isNotNull();
    }

    @Test
    @DisplayName("Alerts are recorded and published when webhooks are enabled")
    void alertsPublished() {
        List<AlertEvent> alerts = List.of(alert());
        when(reconciler.sync()).thenReturn(SyncResult.success(null));
        when(registry.snapshot()).thenReturn(List.of());
        when(alertEngine.evaluateAll(anyCollection(), any(Instant.class))).thenReturn(alerts);
        when(configManager.current()).thenReturn(MonitoringConfig.defaults().toBuilder()
                .webhookPolicy(WebhookPolicy.builder().enabled(true).build())
                .build());

        CycleResult result = cycle.execute();

        assertThat(result.getAlerts()).isEqualTo(alerts);
        verify(registry).recordAlerts(alerts);
        ArgumentCaptor<AlertsRaisedEvent> captor = ArgumentCaptor.forClass(AlertsRaisedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getAlerts()).isEqualTo(alerts);
        assertThat(captor.getValue().getCycleId()).hasSize(8);
    }

    @Test
    @DisplayName("A failed sync continues with the last known items and marks the store unavailable")
    void syncFailureContinues() {
        when(reconciler.sync()).thenReturn(SyncResult.failure("connection refused"));
        when(registry.snapshot()).thenReturn(List.of());
        when(alertEngine.evaluateAll(anyCollection(), any(Instant.class))).thenReturn(List.of());
        when(configManager.current()).thenReturn(MonitoringConfig.defaults());

        CycleResult result = cycle.execute();

        assertThat(result.isSkipped()).isFalse();
        verify(stageTransitionService).detectTransitions();
        verify(eventPublisher, never()).publishEvent(any(AlertsRaisedEvent.class));

        HealthStatus health = healthTracker.snapshot();
        assertThat(health.isStoreOk()).isFalse();
        assertThat(health.isHealthy()).isFalse();
        assertThat(health.getLastError()).contains("connection refused");
    }

    @Test
    @DisplayName("The next successful sync restores store health")
    void syncRecoveryRestoresHealth() {
        when(reconciler.sync()).thenReturn(SyncResult.failure("connection refused"), SyncResult.success(null));
        when(registry.snapshot()).thenReturn(List.of());
        when(alertEngine.evaluateAll(anyCollection(), any(Instant.class))).thenReturn(List.of());
        when(configManager.current()).thenReturn(MonitoringConfig.defaults());

        cycle.execute();
        assertThat(healthTracker.snapshot().isHealthy()).isFalse();

        cycle.execute();

        HealthStatus health = healthTracker.snapshot();
        assertThat(health.isStoreOk()).isTrue();
        assertThat(health.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("An error in the cycle body is wrapped and counted")
    void bodyFailureWrapped() {
        when(reconciler.sync()).thenReturn(SyncResult.success(null));
        when(registry.snapshot()).thenReturn(List.of());
        when(alertEngine.evaluateAll(anyCollection(), any(Instant.class)))
                .thenThrow(new IllegalStateException("evaluation failed"));

        assertThatThrownBy(() -> cycle.execute())
                .isInstanceOf(CycleExecutionException.class)
                .hasMessageContaining("evaluation failed");
        assertThat(meterRegistry.counter("monitoring.cycle.failed").count()).isEqualTo(1.0);
    }
}
