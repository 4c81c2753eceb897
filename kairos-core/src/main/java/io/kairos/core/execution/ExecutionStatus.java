package io.kairos.core.execution;

import java.util.EnumSet;
import java.util.Set;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * RUNNING and RETRYING executions occupy their job's lane.
     */
    public boolean isActive() {
        return this == RUNNING || this == RETRYING;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<ExecutionStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED, RETRYING);
            case RETRYING -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }
}
