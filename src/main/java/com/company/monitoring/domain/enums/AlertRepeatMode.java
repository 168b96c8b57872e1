package com.company.monitoring.domain.enums;

/**
 * How often an alert condition that keeps holding is reported.
 */
public enum AlertRepeatMode {
    /** Report the first evaluation of an episode, re-arm on recovery. */
    LATCHED,
    /** Report every evaluation while the condition holds. */
    REPEAT;

    public static AlertRepeatMode fromString(String mode) {
        if (mode == null) {
            return LATCHED;
        }
        try {
            return AlertRepeatMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return LATCHED;
        }
    }
}
