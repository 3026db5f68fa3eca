package com.company.pmm.util;

import java.time.Duration;
import java.time.Instant;

public class TimeUtils {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    /**
     * Fractional hours between two instants, e.g. 18.5
     */
    public static double hoursBetween(Instant from, Instant to) {
        if (from == null || to == null) return 0.0;
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }

    public static boolean within(Instant instant, Instant from, Instant to) {
        if (instant == null) return false;
        return !instant.isBefore(from) && !instant.isAfter(to);
    }

    public static Duration hours(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("Period must be positive, got " + hours + "h");
        }
        return Duration.ofHours(hours);
    }

    public static Duration days(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Period must be positive, got " + days + "d");
        }
        return Duration.ofDays(days);
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

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
