package com.company.monitoring.controller;

import com.company.monitoring.domain.HealthStatus;
import com.company.monitoring.service.HealthStatusTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the monitoring health snapshot as the {@code monitoring} actuator component.
 */
@Component("monitoring")
@RequiredArgsConstructor
public class MonitoringHealthIndicator implements HealthIndicator {

    private final HealthStatusTracker healthTracker;

    @Override
    public Health health() {
        HealthStatus status = healthTracker.snapshot();
        Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();
        builder.withDetail("schedulerState", String.valueOf(status.getSchedulerState()))
                .withDetail("monitoredItems", status.getMonitoredItemCount())
                .withDetail("consecutiveErrors", status.getConsecutiveErrorCount())
                .withDetail("storeOk", status.isStoreOk())
                .withDetail("apiOk", status.isApiOk())
                .withDetail("configOk", status.isConfigOk());
        if (status.getLastCycleAt() != null) {
            builder.withDetail("lastCycleAt", status.getLastCycleAt().toString());
        }
        if (status.getLastError() != null) {
            builder.withDetail("lastError", status.getLastError());
        }
        return builder.build();
    }
}
