package io.kairos.core.execution;

import io.kairos.core.model.Attributes;
import java.time.Instant;
import java.util.Objects;

/**
 * A status transition of an execution together with the fields that change with it.
 */
public final class ExecutionPatch {
    private final ExecutionStatus status;
    private final Instant at;
    private final Attributes result;
    private final ExecutionError error;
    private final boolean incrementRetry;

    private ExecutionPatch(ExecutionStatus status, Instant at, Attributes result, ExecutionError error, boolean incrementRetry) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.at = Objects.requireNonNull(at, "at must not be null");
        this.result = result;
        this.error = error;
        this.incrementRetry = incrementRetry;
    }

    public static ExecutionPatch running(Instant at) {
        return new ExecutionPatch(ExecutionStatus.RUNNING, at, null, null, false);
    }

    public static ExecutionPatch retrying(ExecutionError error, Instant at) {
        return new ExecutionPatch(ExecutionStatus.RETRYING, at, null, error, true);
    }

    public static ExecutionPatch completed(Attributes result, Instant at) {
        return new ExecutionPatch(ExecutionStatus.COMPLETED, at, result, null, false);
    }

    public static ExecutionPatch failed(ExecutionError error, Instant at) {
        return new ExecutionPatch(ExecutionStatus.FAILED, at, null, error, false);
    }

    public static ExecutionPatch cancelled(String reason, Instant at) {
        return new ExecutionPatch(
            ExecutionStatus.CANCELLED,
            at,
            null,
            new ExecutionError(ExecutionError.CANCELLED, reason, false),
            false
        );
    }

    public ExecutionStatus status() {
        return status;
    }

    /**
     * @throws IllegalStateException if the execution cannot move to this status
     */
    public JobExecution applyTo(JobExecution current) {
        if (!current.status().canTransitionTo(status)) {
            throw new IllegalStateException(
                "Execution " + current.id() + " cannot move from " + current.status() + " to " + status
            );
        }
        Instant startedAt = current.startedAt();
        if (status == ExecutionStatus.RUNNING && startedAt == null) {
            startedAt = at;
        }
        ExecutionError nextError = switch (status) {
            case COMPLETED -> null;
            case RUNNING -> current.error();
            default -> error != null ? error : current.error();
        };
        return new JobExecution(
            current.id(),
            current.jobId(),
            status,
            current.trigger(),
            current.scheduledFor(),
            current.createdAt(),
            startedAt,
            status.isTerminal() ? at : null,
            result != null ? result : current.result(),
            nextError,
            incrementRetry ? current.retryCount() + 1 : current.retryCount()
        );
    }
}
