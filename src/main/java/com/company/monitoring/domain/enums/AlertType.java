package com.company.monitoring.domain.enums;

public enum AlertType {
    THRESHOLD("Value stayed below threshold for the alert duration"),
    FROZEN("Value has not changed for the frozen threshold"),
    ERROR("Telemetry could not be read");

    private final String description;

    AlertType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
