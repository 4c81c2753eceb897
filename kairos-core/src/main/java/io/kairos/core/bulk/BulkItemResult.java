package io.kairos.core.bulk;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.kairos.core.error.ErrorCode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BulkItemResult(String jobId, boolean success, ErrorCode errorCode, String message) {

    public static BulkItemResult ok(String jobId) {
        return new BulkItemResult(jobId, true, null, null);
    }

    public static BulkItemResult failed(String jobId, ErrorCode errorCode, String message) {
        return new BulkItemResult(jobId, false, errorCode, message);
    }
}
