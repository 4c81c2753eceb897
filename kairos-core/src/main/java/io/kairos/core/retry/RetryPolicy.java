package io.kairos.core.retry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Retry settings of an action. {@code backoffMultiplier} defaults to 1 (constant delay) and
 * {@code maxRetryDelayMs} to no cap.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryPolicy(
    int maxRetries,
    long retryDelayMs,
    Double backoffMultiplier,
    Long maxRetryDelayMs
) {

    public static RetryPolicy none() {
        return new RetryPolicy(0, 0, null, null);
    }

    public static RetryPolicy exponential(int maxRetries, long retryDelayMs, double backoffMultiplier, long maxRetryDelayMs) {
        return new RetryPolicy(maxRetries, retryDelayMs, backoffMultiplier, maxRetryDelayMs);
    }

    public double effectiveMultiplier() {
        return backoffMultiplier == null ? 1.0 : backoffMultiplier;
    }
}
