package com.company.monitoring.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Threshold debounce state for a single header.
 * While {@code active}, {@code startTime} is when the value last dropped below threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertTimerState {
    private Instant startTime;
    private Object lastValue;
    private boolean active;
    private boolean fired;
    private String category;
    private Instant lastObservedAt;
}
