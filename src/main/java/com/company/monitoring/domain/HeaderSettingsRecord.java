package com.company.monitoring.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of {@code project_header_settings}: the persisted monitoring flag and overrides of one header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeaderSettingsRecord {
    private String projectId;
    private String headerId;
    private String headerName;
    private Double threshold;
    private Long alertDurationMs;
    private Long frozenThresholdMs;
    private Boolean monitored;
    private Instant lastUpdated;
}
