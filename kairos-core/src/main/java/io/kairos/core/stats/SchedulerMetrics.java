package io.kairos.core.stats;

import java.util.List;

/**
 * Scheduler-wide snapshot. {@code unavailable} names the parts that could not be computed; their
 * fields are left at zero instead of failing the whole snapshot.
 */
public record SchedulerMetrics(
    int totalJobs,
    int activeJobs,
    int pausedJobs,
    int executionsToday,
    double successRate,
    double failureRate,
    double averageExecutionTimeMs,
    List<UpcomingJob> upcomingJobs,
    List<String> unavailable
) {
    public SchedulerMetrics {
        upcomingJobs = upcomingJobs == null ? List.of() : List.copyOf(upcomingJobs);
        unavailable = unavailable == null ? List.of() : List.copyOf(unavailable);
    }

    public boolean partial() {
        return !unavailable.isEmpty();
    }
}
