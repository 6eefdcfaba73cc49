package io.launchmanager.plugins;

import java.time.Duration;
import java.time.Instant;

final class Durations {
    private Durations() {
    }

    static Duration between(Instant start, Instant end) {
        Duration duration = Duration.between(start, end);
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    /**
     * {@code 45s}, {@code 3m 5s} or {@code 2h 4m}.
     */
    static String format(Duration duration) {
        long total = duration.getSeconds();
        if (total < 60) {
            return total + "s";
        }
        if (total < 3600) {
            return (total / 60) + "m " + (total % 60) + "s";
        }
        return (total / 3600) + "h " + ((total % 3600) / 60) + "m";
    }

    static Instant parseOr(Object value, Instant fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Instant.parse(String.valueOf(value));
        } catch (RuntimeException e) {
            return fallback;
        }
    }
}
