package io.kairos.core.execution;

public enum ExecutionTrigger {
    SCHEDULED,
    MANUAL
}
