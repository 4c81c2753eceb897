package io.kairos.core.engine;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

public record SchedulerSettings(
    Duration tickInterval,
    int maxConcurrentExecutions,
    Duration defaultTimeout,
    Duration cancelGrace,
    MissedRunPolicy missedRunPolicy,
    ZoneId zone
) {
    public SchedulerSettings {
        Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        Objects.requireNonNull(cancelGrace, "cancelGrace must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (maxConcurrentExecutions < 1) {
            throw new IllegalArgumentException("maxConcurrentExecutions must be >= 1");
        }
        missedRunPolicy = missedRunPolicy == null ? MissedRunPolicy.COALESCE : missedRunPolicy;
        zone = zone == null ? ZoneId.of("UTC") : zone;
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
            Duration.ofSeconds(5),
            8,
            Duration.ofSeconds(300),
            Duration.ofSeconds(10),
            MissedRunPolicy.COALESCE,
            ZoneId.of("UTC")
        );
    }
}
