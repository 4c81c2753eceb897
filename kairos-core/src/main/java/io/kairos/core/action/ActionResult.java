package io.kairos.core.action;

import io.kairos.core.model.Attributes;

public record ActionResult(boolean success, Attributes data, String errorCode, String message, boolean retryable) {
    public ActionResult {
        data = data == null ? Attributes.empty() : data;
    }

    public static ActionResult success(Attributes data) {
        return new ActionResult(true, data, null, null, false);
    }

    public static ActionResult failure(String errorCode, String message, boolean retryable) {
        return new ActionResult(false, Attributes.empty(), errorCode, message, retryable);
    }
}
