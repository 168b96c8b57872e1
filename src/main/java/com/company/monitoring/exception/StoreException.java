package com.company.monitoring.exception;

/**
 * The persisted store could not be reached or a query failed.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
