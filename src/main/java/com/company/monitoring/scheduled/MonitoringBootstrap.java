package com.company.monitoring.scheduled;

import com.company.monitoring.client.TelemetryClient;
import com.company.monitoring.domain.ConfigReloadResult;
import com.company.monitoring.service.HealthStatusTracker;
import com.company.monitoring.service.MonitoringConfigManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads configuration and starts the scheduler once the application is ready.
 * Registry and config are always rebuilt from the store; nothing survives a restart.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MonitoringBootstrap {

    private final MonitoringConfigManager configManager;
    private final MonitoringCycleScheduler scheduler;
    private final TelemetryClient telemetryClient;
    private final HealthStatusTracker healthTracker;

    @Value("${monitoring.autostart:true}")
    private boolean autostart = true;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        healthTracker.recordStartup();

        if (!telemetryClient.ping()) {
            log.warn("Telemetry API is not reachable at startup, cycles will record fetch errors until it is");
        }

        ConfigReloadResult result = configManager.reload();
        if (!result.isSuccess()) {
            log.warn("Starting with default configuration: {}", result.getError());
        }

        if (autostart) {
            scheduler.start();
        } else {
            log.info("Monitoring autostart disabled, scheduler not started");
        }
    }
}
