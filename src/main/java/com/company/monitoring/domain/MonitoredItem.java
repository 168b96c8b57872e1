package com.company.monitoring.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * One header under observation. Threshold and durations are the values stored
 * for the header itself; category defaults are applied by the config manager.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredItem {
    private String headerId;
    private String projectId;
    private String companyId;
    private String stageId;
    private String headerName;
    private String category;
    private Double threshold;
    private Long alertDurationMs;
    private Long frozenThresholdMs;

    public boolean hasSameAlertSettings(MonitoredItem other) {
        return Objects.equals(threshold, other.threshold)
                && Objects.equals(alertDurationMs, other.alertDurationMs)
                && Objects.equals(frozenThresholdMs, other.frozenThresholdMs);
    }
}
