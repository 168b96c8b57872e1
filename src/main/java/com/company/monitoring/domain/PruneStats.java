package com.company.monitoring.domain;

import lombok.Value;

@Value
public class PruneStats {
    int alertStatesPruned;
    int frozenStatesPruned;
    int headerValuesPruned;
    int alertEventsPruned;

    public int total() {
        return alertStatesPruned + frozenStatesPruned + headerValuesPruned + alertEventsPruned;
    }
}
