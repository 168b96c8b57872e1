package com.company.monitoring.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last distinct value seen for a header and when it changed.
 * {@code lastChangeTime} only moves when the observed value differs from {@code lastValue}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FrozenTrackState {
    private Object lastValue;
    private Instant lastChangeTime;
    private boolean fired;
    private String category;
    private Instant lastObservedAt;
}
