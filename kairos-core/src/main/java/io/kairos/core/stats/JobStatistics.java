package io.kairos.core.stats;

import java.time.Instant;

public record JobStatistics(
    String jobId,
    int totalExecutions,
    int successfulExecutions,
    int failedExecutions,
    double successRate,
    double averageDurationMs,
    Instant lastExecution,
    Instant nextExecution
) {
}
