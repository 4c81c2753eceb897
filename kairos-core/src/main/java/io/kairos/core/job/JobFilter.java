package io.kairos.core.job;

import io.kairos.core.schedule.JobType;
import java.time.Instant;

/**
 * Conjunctive job query. {@code null} criteria match everything. {@code dueAt} selects jobs
 * whose {@code nextRun} is at or before that instant.
 */
public record JobFilter(
    String ownerId,
    JobType type,
    Boolean enabled,
    ActionType actionType,
    Instant createdFrom,
    Instant createdTo,
    Instant dueAt,
    int limit
) {
    public JobFilter {
        limit = limit <= 0 ? Integer.MAX_VALUE : limit;
    }

    public static JobFilter all() {
        return new JobFilter(null, null, null, null, null, null, null, 0);
    }

    public static JobFilter due(Instant now) {
        return new JobFilter(null, null, true, null, null, null, now, 0);
    }

    public JobFilter withLimit(int limit) {
        return new JobFilter(ownerId, type, enabled, actionType, createdFrom, createdTo, dueAt, limit);
    }

    public boolean matches(Job job) {
        if (ownerId != null && !ownerId.equals(job.ownerId())) {
            return false;
        }
        if (type != null && type != job.type()) {
            return false;
        }
        if (enabled != null && enabled != job.enabled()) {
            return false;
        }
        if (actionType != null && actionType != job.action().type()) {
            return false;
        }
        if (createdFrom != null && job.createdAt().isBefore(createdFrom)) {
            return false;
        }
        if (createdTo != null && job.createdAt().isAfter(createdTo)) {
            return false;
        }
        if (dueAt != null && (job.nextRun() == null || job.nextRun().isAfter(dueAt))) {
            return false;
        }
        return true;
    }
}
