package io.kairos.core.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a failed attempt is retried and how long to wait. Pure; no clock, no state.
 */
public final class RetryPolicyEvaluator {

    /**
     * @param retryCount retries already performed for this execution
     */
    public RetryDecision evaluate(RetryPolicy policy, boolean retryable, int retryCount) {
        if (!retryable) {
            return RetryDecision.giveUp("error is not retryable");
        }
        if (policy == null || policy.maxRetries() <= 0) {
            return RetryDecision.giveUp("no retry policy");
        }
        if (retryCount >= policy.maxRetries()) {
            return RetryDecision.giveUp("retries exhausted after " + retryCount + " attempt(s)");
        }
        return RetryDecision.retryAfter(Duration.ofMillis(delayMs(policy, retryCount)));
    }

    /**
     * {@code retryDelayMs * backoffMultiplier^retryCount}, capped at {@code maxRetryDelayMs}.
     */
    public long delayMs(RetryPolicy policy, int retryCount) {
        double raw = policy.retryDelayMs() * Math.pow(policy.effectiveMultiplier(), Math.max(0, retryCount));
        long delay = raw >= Long.MAX_VALUE ? Long.MAX_VALUE : Math.round(raw);
        if (policy.maxRetryDelayMs() != null) {
            delay = Math.min(delay, policy.maxRetryDelayMs());
        }
        return Math.max(0, delay);
    }

    public List<Long> delaySchedule(RetryPolicy policy) {
        List<Long> delays = new ArrayList<>();
        for (int attempt = 0; attempt < policy.maxRetries(); attempt++) {
            delays.add(delayMs(policy, attempt));
        }
        return delays;
    }
}
