package io.kairos.core.stats;

import io.kairos.core.schedule.JobType;
import java.time.Instant;

public record UpcomingJob(String jobId, String name, JobType type, Instant nextRun) {
}
