package com.company.monitoring.exception;

/**
 * Failure of a telemetry API call whose result cannot be expressed as a {@code FetchResult}.
 */
public class TelemetryApiException extends RuntimeException {

    public TelemetryApiException(String message) {
        super(message);
    }

    public TelemetryApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
