package com.company.monitoring.domain;

import lombok.Value;

@Value
public class SyncStats {
    int added;
    int removed;
    int updated;
    int unchanged;

    public boolean hasChanges() {
        return added > 0 || removed > 0 || updated > 0;
    }
}
