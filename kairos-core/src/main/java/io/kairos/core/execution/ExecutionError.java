package io.kairos.core.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionError(String code, String message, boolean retryable) {
    public static final String EXECUTION_TIMEOUT = "EXECUTION_TIMEOUT";
    public static final String HANDLER_NOT_FOUND = "HANDLER_NOT_FOUND";
    public static final String HANDLER_ERROR = "HANDLER_ERROR";
    public static final String IO_ERROR = "IO_ERROR";
    public static final String CANCELLED = "CANCELLED";
    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
}
