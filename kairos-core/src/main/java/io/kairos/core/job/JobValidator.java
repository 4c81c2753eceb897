package io.kairos.core.job;

import io.kairos.core.error.ValidationException;
import io.kairos.core.retry.RetryPolicy;
import io.kairos.core.schedule.ScheduleValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class JobValidator {
    private final ScheduleValidator scheduleValidator;

    public JobValidator(ScheduleValidator scheduleValidator) {
        this.scheduleValidator = Objects.requireNonNull(scheduleValidator, "scheduleValidator must not be null");
    }

    public void validate(JobDefinition definition) {
        List<String> violations = new ArrayList<>();
        if (definition == null) {
            throw new ValidationException("job definition is required");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            violations.add("name is required");
        }
        violations.addAll(scheduleValidator.violations(definition.schedule()));
        violations.addAll(actionViolations(definition.action()));
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public List<String> actionViolations(JobAction action) {
        List<String> violations = new ArrayList<>();
        if (action == null) {
            violations.add("action is required");
            return violations;
        }
        if (action.type() == null) {
            violations.add("action.type is required");
        }
        if (action.target() == null || action.target().isBlank()) {
            violations.add("action.target is required");
        }
        if (action.method() == null || action.method().isBlank()) {
            violations.add("action.method is required");
        }
        if (action.timeoutSeconds() != null && action.timeoutSeconds() <= 0) {
            violations.add("action.timeoutSeconds must be > 0");
        }
        RetryPolicy retry = action.retryPolicy();
        if (retry != null) {
            if (retry.maxRetries() < 0) {
                violations.add("retryPolicy.maxRetries must be >= 0");
            }
            if (retry.retryDelayMs() < 0) {
                violations.add("retryPolicy.retryDelayMs must be >= 0");
            }
            if (retry.backoffMultiplier() != null && retry.backoffMultiplier() < 1.0) {
                violations.add("retryPolicy.backoffMultiplier must be >= 1");
            }
            if (retry.maxRetryDelayMs() != null && retry.maxRetryDelayMs() < retry.retryDelayMs()) {
                violations.add("retryPolicy.maxRetryDelayMs must be >= retryDelayMs");
            }
        }
        return violations;
    }
}
