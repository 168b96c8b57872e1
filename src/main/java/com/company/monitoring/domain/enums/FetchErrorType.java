package com.company.monitoring.domain.enums;

public enum FetchErrorType {
    HTTP_STATUS("API returned a non-success status"),
    NO_CONTENT("API returned no content"),
    MALFORMED_PAYLOAD("API response could not be interpreted"),
    NETWORK("API could not be reached"),
    TIMEOUT("API did not answer in time");

    private final String description;

    FetchErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
