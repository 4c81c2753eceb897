package io.kairos.core.engine;

import io.kairos.core.execution.ExecutionTrigger;
import io.kairos.core.model.Attributes;
import java.time.Instant;
import java.util.Objects;

public record Occurrence(String jobId, Instant scheduledFor, ExecutionTrigger trigger, Attributes overrides) {
    public Occurrence {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(scheduledFor, "scheduledFor must not be null");
        trigger = trigger == null ? ExecutionTrigger.SCHEDULED : trigger;
        overrides = overrides == null ? Attributes.empty() : overrides;
    }

    public static Occurrence scheduled(String jobId, Instant scheduledFor) {
        return new Occurrence(jobId, scheduledFor, ExecutionTrigger.SCHEDULED, Attributes.empty());
    }

    public static Occurrence manual(String jobId, Instant requestedAt, Attributes overrides) {
        return new Occurrence(jobId, requestedAt, ExecutionTrigger.MANUAL, overrides);
    }
}
