package com.company.monitoring.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigReloadResponse {
    private boolean success;
    private String error;
    private boolean usingFallback;
    private boolean intervalChanged;
    private long pollingIntervalMs;
    private Set<String> patternCategories;
    private int headerOverrides;
    private boolean webhooksEnabled;
    private Instant lastUpdated;
}
