package com.company.monitoring.exception;

public class CycleExecutionException extends RuntimeException {
    public CycleExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
