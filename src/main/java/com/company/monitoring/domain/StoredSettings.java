package com.company.monitoring.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw settings row as persisted. JSON columns are parsed and validated by the config manager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredSettings {
    private Long pollingIntervalMs;
    private String patternCategoriesJson;
    private String webhooksJson;
    private Instant lastUpdated;
}
