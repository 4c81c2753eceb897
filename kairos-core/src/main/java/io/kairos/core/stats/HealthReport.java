package io.kairos.core.stats;

import java.time.Instant;
import java.util.List;

public record HealthReport(Instant checkedAt, List<String> sweptExecutions, List<String> disabledJobs) {
    public HealthReport {
        sweptExecutions = List.copyOf(sweptExecutions);
        disabledJobs = List.copyOf(disabledJobs);
    }
}
