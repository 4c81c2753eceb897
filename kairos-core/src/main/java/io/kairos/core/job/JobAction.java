package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.model.Attributes;
import io.kairos.core.retry.RetryPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobAction(
    ActionType type,
    String target,
    String method,
    Attributes parameters,
    RetryPolicy retryPolicy,
    Integer timeoutSeconds
) {
    public JobAction {
        parameters = parameters == null ? Attributes.empty() : parameters;
    }

    public static JobAction of(ActionType type, String target, String method, Attributes parameters) {
        return new JobAction(type, target, method, parameters, null, null);
    }

    public JobAction withRetryPolicy(RetryPolicy policy) {
        return new JobAction(type, target, method, parameters, policy, timeoutSeconds);
    }

    public JobAction withTimeoutSeconds(Integer seconds) {
        return new JobAction(type, target, method, parameters, retryPolicy, seconds);
    }
}
