package io.kairos.core.error;

public enum ErrorCode {
    VALIDATION_ERROR,
    JOB_NOT_FOUND,
    TEMPLATE_NOT_FOUND,
    EXECUTION_NOT_FOUND,
    STORE_UNAVAILABLE,
    INTERNAL_ERROR
}
