package io.kairos.core.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kairos.core.model.Attributes;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One occurrence of a job. Retries of the occurrence reuse the same record.
 *
 * <p>{@code completedAt} is set exactly when the status is terminal, {@code startedAt} once the
 * handler has been invoked for the first time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobExecution(
    String id,
    String jobId,
    ExecutionStatus status,
    ExecutionTrigger trigger,
    Instant scheduledFor,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Attributes result,
    ExecutionError error,
    int retryCount
) {
    public JobExecution {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        trigger = trigger == null ? ExecutionTrigger.SCHEDULED : trigger;
        result = result == null ? Attributes.empty() : result;
    }

    public static JobExecution pending(String id, String jobId, ExecutionTrigger trigger, Instant scheduledFor, Instant createdAt) {
        return new JobExecution(id, jobId, ExecutionStatus.PENDING, trigger, scheduledFor, createdAt, null, null, null, null, 0);
    }

    @JsonProperty(value = "durationMs", access = JsonProperty.Access.READ_ONLY)
    public Long durationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
