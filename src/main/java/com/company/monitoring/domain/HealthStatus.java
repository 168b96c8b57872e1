package com.company.monitoring.domain;

import com.company.monitoring.domain.enums.SchedulerState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class HealthStatus {
    Instant startedAt;
    Instant lastCycleAt;
    Instant lastSuccessAt;
    Instant lastHealthCheckAt;
    int consecutiveErrorCount;
    boolean healthy;
    boolean storeOk;
    boolean apiOk;
    boolean configOk;
    String lastError;
    SchedulerState schedulerState;
    int monitoredItemCount;
}
