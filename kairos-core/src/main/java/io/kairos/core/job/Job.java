package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.JobSchedule;
import io.kairos.core.schedule.JobType;
import java.time.Instant;
import java.util.Objects;

/**
 * A scheduled job. The job type is always the type of its schedule; {@code nextRun} is
 * {@code null} when the schedule is exhausted or the job is disabled.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
    String id,
    String ownerId,
    String name,
    String description,
    JobSchedule schedule,
    JobAction action,
    boolean enabled,
    Attributes metadata,
    Instant lastRun,
    Instant nextRun,
    Instant createdAt,
    Instant updatedAt
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        metadata = metadata == null ? Attributes.empty() : metadata;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    @JsonProperty(value = "type", access = JsonProperty.Access.READ_ONLY)
    public JobType type() {
        return schedule.type();
    }

    public Job withState(boolean enabled, Instant lastRun, Instant nextRun, Instant updatedAt) {
        return new Job(id, ownerId, name, description, schedule, action, enabled, metadata, lastRun, nextRun, createdAt, updatedAt);
    }

    public Job withNextRun(Instant nextRun, Instant updatedAt) {
        return withState(enabled, lastRun, nextRun, updatedAt);
    }
}
