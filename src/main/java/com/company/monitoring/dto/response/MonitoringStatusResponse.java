package com.company.monitoring.dto.response;

import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.enums.SchedulerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringStatusResponse {
    private SchedulerState schedulerState;
    private boolean started;
    private long pollingIntervalMs;
    private int monitoredItems;
    private int alertTimerStates;
    private int frozenStates;
    private Instant lastCycleAt;
    private Instant lastSuccessAt;
    private List<AlertEvent> recentAlerts;
}
