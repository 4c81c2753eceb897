package io.kairos.core.error;

import java.util.List;

public final class ValidationException extends SchedulerException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(ErrorCode.VALIDATION_ERROR, "Invalid job definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> violations() {
        return violations;
    }
}
