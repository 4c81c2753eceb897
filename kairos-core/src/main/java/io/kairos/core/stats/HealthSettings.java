package io.kairos.core.stats;

import java.time.Duration;
import java.util.Objects;

/**
 * @param stuckAfter unfinished executions older than this are closed by the sweep
 * @param maxFailures a job with more FAILED executions than this inside {@code failureWindow} is disabled
 */
public record HealthSettings(
    Duration checkInterval,
    Duration stuckAfter,
    int maxFailures,
    Duration failureWindow
) {
    public HealthSettings {
        Objects.requireNonNull(checkInterval, "checkInterval must not be null");
        Objects.requireNonNull(stuckAfter, "stuckAfter must not be null");
        Objects.requireNonNull(failureWindow, "failureWindow must not be null");
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive");
        }
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be >= 1");
        }
    }

    public static HealthSettings defaults() {
        return new HealthSettings(Duration.ofMinutes(5), Duration.ofHours(1), 5, Duration.ofHours(24));
    }
}
