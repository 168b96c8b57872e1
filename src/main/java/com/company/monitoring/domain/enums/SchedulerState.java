package com.company.monitoring.domain.enums;

public enum SchedulerState {
    IDLE("No cycle is queued or executing"),
    PENDING("A cycle has been queued but has not started"),
    RUNNING("A cycle is executing"),
    SHUTTING_DOWN("Stop requested, new cycles are suppressed");

    private final String description;

    SchedulerState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean acceptsNewCycle() {
        return this == IDLE;
    }
}
