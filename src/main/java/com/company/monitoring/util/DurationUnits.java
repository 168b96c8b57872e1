package com.company.monitoring.util;

/**
 * Settings and store columns express durations in seconds; the engine works in milliseconds.
 */
public final class DurationUnits {

    private DurationUnits() {
    }

    public static Long secondsToMillis(Number seconds) {
        if (seconds == null) return null;
        return Math.round(seconds.doubleValue() * 1000);
    }

    public static Long millisToSeconds(Long millis) {
        if (millis == null) return null;
        return millis / 1000;
    }

    public static String formatDuration(long durationMs) {
        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
