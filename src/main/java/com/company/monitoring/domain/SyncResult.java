package com.company.monitoring.domain;

import lombok.Value;

@Value
public class SyncResult {
    boolean success;
    SyncStats stats;
    String error;

    public static SyncResult success(SyncStats stats) {
        return new SyncResult(true, stats, null);
    }

    public static SyncResult failure(String error) {
        return new SyncResult(false, null, error);
    }
}
