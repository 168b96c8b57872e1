package com.company.monitoring.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CycleResult {
    boolean skipped;
    String skipReason;
    int headerCount;
    int fetchErrors;
    @Builder.Default
    List<AlertEvent> alerts = List.of();
    long durationMs;

    public static CycleResult skipped(String reason) {
        return CycleResult.builder().skipped(true).skipReason(reason).build();
    }
}
