package com.company.monitoring.service;

import com.company.monitoring.domain.AlertTimerState;
import com.company.monitoring.domain.FrozenTrackState;
import com.company.monitoring.domain.MonitoredItem;
import com.company.monitoring.domain.SyncResult;
import com.company.monitoring.repository.MonitoredHeaderRepository;
import com.company.monitoring.repository.MonitoringSettingsRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistryReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private MonitoredHeaderRepository headerRepository;

    private MonitoredItemRegistry registry;
    private HealthStatusTracker healthTracker;
    private RegistryReconciler reconciler;

    @BeforeEach
    void setUp() {
        registry = new MonitoredItemRegistry();
        healthTracker = new HealthStatusTracker(Clock.fixed(NOW, ZoneOffset.UTC));
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MonitoringConfigManager configManager = new MonitoringConfigManager(mock(MonitoringSettingsRepository.class),
                new ObjectMapper(), mock(ApplicationEventPublisher.class), healthTracker, meterRegistry);
        reconciler = new RegistryReconciler(headerRepository, registry, new PatternClassifier(configManager),
                healthTracker, meterRegistry);
    }

    private static MonitoredItem header(String id, String name, Double threshold) {
        return MonitoredItem.builder()
                .headerId(id)
                .headerName(name)
                .projectId("p-1")
                .companyId("c-1")
                .stageId("s-1")
                .threshold(threshold)
                .build();
    }

    @Test
    @DisplayName("New store headers are added and classified")
    void addsAndClassifies() {
        when(headerRepository.findMonitoredHeaders()).thenReturn(List.of(
                header("1", "Casing Pressure", null),
                header("2", "Battery Voltage", 15.0),
                header("3", "Slurry Rate", null)));

        SyncResult result = reconciler.sync();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStats().getAdded()).isEqualTo(3);
        assertThat(registry.find("1").get().getCategory()).isEqualTo("pressure");
        assertThat(registry.find("2").get().getCategory()).isEqualTo("battery");
        assertThat(registry.find("3").get().getCategory()).isNull();
        assertThat(healthTracker.snapshot().getMonitoredItemCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Second sync without store changes reports no changes")
    void syncIsIdempotent() {
        when(headerRepository.findMonitoredHeaders()).thenReturn(List.of(
                header("1", "Casing Pressure", null),
                header("2", "Battery Voltage", 15.0)));

        reconciler.sync();
        SyncResult second = reconciler.sync();

        assertThat(second.getStats().getAdded()).isZero();
        assertThat(second.getStats().getRemoved()).isZero();
        assertThat(second.getStats().getUpdated()).isZero();
        assertThat(second.getStats().getUnchanged()).isEqualTo(2);
        assertThat(second.getStats().hasChanges()).isFalse();
    }

    @Test
    @DisplayName("Removed headers lose their alert and frozen state")
    void removalDropsTrackingState() {
        when(headerRepository.findMonitoredHeaders())
                .thenReturn(List.of(header("1", "Casing Pressure", null), header("2", "Battery", null)))
                .thenReturn(List.of(header("2", "Battery", null)));
        reconciler.sync();
        registry.putAlertTimer("1", AlertTimerState.builder().active(true).startTime(NOW).build());
        registry.putFrozenState("1", FrozenTrackState.builder().lastValue(1.0).lastChangeTime(NOW).build());

        SyncResult result = reconciler.sync();

        assertThat(result.getStats().getRemoved()).isEqualTo(1);
        assertThat(registry.isMonitored("1")).isFalse();
        assertThat(registry.alertTimer("1")).isEmpty();
        assertThat(registry.frozenState("1")).isEmpty();
    }

    @Test
    @DisplayName("Changed alert settings count as updates and keep tracking state")
    void updatesKeepState() {
        when(headerRepository.findMonitoredHeaders())
                .thenReturn(List.of(header("1", "Casing Pressure", 20.0)))
                .thenReturn(List.of(header("1", "Casing Pressure", 30.0)));
        reconciler.sync();
        registry.recordLastValue("1", 25.0, NOW);
        registry.putFrozenState("1", FrozenTrackState.builder().lastValue(25.0).lastChangeTime(NOW).build());

        SyncResult result = reconciler.sync();

        assertThat(result.getStats().getUpdated()).isEqualTo(1);
        assertThat(registry.find("1").get().getThreshold()).isEqualTo(30.0);
        assertThat(registry.find("1").get().getCategory()).isEqualTo("pressure");
        assertThat(registry.frozenState("1")).isPresent();
        assertThat(registry.lastValue("1")).isPresent();
    }

    @Test
    @DisplayName("Metadata changes refresh the item without counting as an update")
    void metadataRefresh() {
        MonitoredItem moved = header("1", "Casing Pressure", null).toBuilder().stageId("s-2").build();
        when(headerRepository.findMonitoredHeaders())
                .thenReturn(List.of(header("1", "Casing Pressure", null)))
                .thenReturn(List.of(moved));
        reconciler.sync();

        SyncResult result = reconciler.sync();

        assertThat(result.getStats().getUpdated()).isZero();
        assertThat(result.getStats().getUnchanged()).isEqualTo(1);
        assertThat(registry.find("1").get().getStageId()).isEqualTo("s-2");
    }

    @Test
    @DisplayName("Store failure leaves the registry untouched")
    void storeFailureDoesNotMutate() {
        when(headerRepository.findMonitoredHeaders())
                .thenReturn(List.of(header("1", "Casing Pressure", null)))
                .thenThrow(new QueryTimeoutException("timeout"));
        reconciler.sync();

        SyncResult result = reconciler.sync();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("timeout");
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.isMonitored("1")).isTrue();
    }
}
