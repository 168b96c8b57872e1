package com.company.monitoring.controller;

import com.company.monitoring.domain.ConfigReloadResult;
import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.domain.MonitoringConfig;
import com.company.monitoring.dto.response.ConfigReloadResponse;
import com.company.monitoring.dto.response.MonitoringStatusResponse;
import com.company.monitoring.scheduled.MonitoringCycleScheduler;
import com.company.monitoring.service.HealthStatusTracker;
import com.company.monitoring.service.MonitoredItemRegistry;
import com.company.monitoring.service.MonitoringConfigManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Monitoring", description = "Scheduler status and configuration reload")
public class MonitoringController {

    private final MonitoringCycleScheduler scheduler;
    private final MonitoringConfigManager configManager;
    private final MonitoredItemRegistry registry;
    private final HealthStatusTracker healthTracker;

    @GetMapping("/status")
    @Operation(summary = "Scheduler state, monitored items and recent alerts")
    public ResponseEntity<MonitoringStatusResponse> status() {
        HealthStatus health = healthTracker.snapshot();
        return ResponseEntity.ok(MonitoringStatusResponse.builder()
                .schedulerState(scheduler.getState())
                .started(scheduler.isStarted())
                .pollingIntervalMs(configManager.current().getPollingIntervalMs())
                .monitoredItems(registry.size())
                .alertTimerStates(registry.alertTimerCount())
                .frozenStates(registry.frozenStateCount())
                .lastCycleAt(health.getLastCycleAt())
                .lastSuccessAt(health.getLastSuccessAt())
                .recentAlerts(registry.recentAlerts())
                .build());
    }

    @PostMapping("/config/reload")
    @Operation(summary = "Reload monitoring configuration from the store")
    public ResponseEntity<ConfigReloadResponse> reloadConfig() {
        log.info("Configuration reload requested");
        ConfigReloadResult result = configManager.reload();
        MonitoringConfig config = result.getConfig();

        ConfigReloadResponse response = ConfigReloadResponse.builder()
                .success(result.isSuccess())
                .error(result.getError())
                .usingFallback(result.isUsingFallback())
                .intervalChanged(result.isIntervalChanged())
                .pollingIntervalMs(config.getPollingIntervalMs())
                .patternCategories(config.getPatternCategories().keySet())
                .headerOverrides(config.getHeaderOverrides().size())
                .webhooksEnabled(config.getWebhookPolicy().isEnabled())
                .lastUpdated(config.getLastUpdated())
                .build();

        return ResponseEntity
                .status(result.isSuccess() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(response);
    }
}
