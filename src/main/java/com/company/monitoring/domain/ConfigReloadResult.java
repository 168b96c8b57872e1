package com.company.monitoring.domain;

import lombok.Value;

@Value
public class ConfigReloadResult {
    boolean success;
    MonitoringConfig config;
    String error;
    boolean usingFallback;
    boolean intervalChanged;

    public static ConfigReloadResult success(MonitoringConfig config, boolean intervalChanged) {
        return new ConfigReloadResult(true, config, null, false, intervalChanged);
    }

    public static ConfigReloadResult failure(MonitoringConfig fallback, String error) {
        return new ConfigReloadResult(false, fallback, error, true, false);
    }
}
