package com.company.monitoring.domain;

import lombok.Value;

/**
 * Effective thresholds for one header after overrides and category defaults are applied.
 */
@Value
public class ResolvedAlertSettings {
    Double threshold;
    long alertDurationMs;
    long frozenThresholdMs;
    String category;
}
