package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.stats.HealthSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthConfig(
    boolean enabled,
    int checkIntervalMinutes,
    int stuckAfterMinutes,
    int maxFailures,
    int failureWindowHours
) {

    public static HealthConfig defaults() {
        return new HealthConfig(true, 5, 60, 5, 24);
    }

    public HealthSettings toSettings() {
        return new HealthSettings(
            Duration.ofMinutes(checkIntervalMinutes),
            Duration.ofMinutes(stuckAfterMinutes),
            maxFailures,
            Duration.ofHours(failureWindowHours)
        );
    }
}
