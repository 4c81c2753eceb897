package io.kairos.core.action;

import io.kairos.core.model.Attributes;
import java.time.Instant;

/**
 * Per-attempt invocation context. {@code parameters} already include any execute-now overrides.
 */
public record ActionContext(
    String jobId,
    String executionId,
    String ownerId,
    int attempt,
    Attributes parameters,
    Attributes metadata,
    Instant scheduledFor,
    CancellationSignal signal
) {
}
