package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.engine.MissedRunPolicy;
import io.kairos.core.engine.SchedulerSettings;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    int tickSeconds,
    int maxConcurrentExecutions,
    int defaultTimeoutSeconds,
    int cancelGraceSeconds,
    MissedRunPolicy missedRunPolicy,
    String zone
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(5, 8, 300, 10, MissedRunPolicy.COALESCE, "UTC");
    }

    public SchedulerSettings toSettings() {
        return new SchedulerSettings(
            Duration.ofSeconds(tickSeconds),
            maxConcurrentExecutions,
            Duration.ofSeconds(defaultTimeoutSeconds),
            Duration.ofSeconds(cancelGraceSeconds),
            missedRunPolicy,
            ZoneId.of(zone == null || zone.isBlank() ? "UTC" : zone.trim())
        );
    }
}
