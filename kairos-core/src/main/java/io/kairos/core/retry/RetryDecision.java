package io.kairos.core.retry;

import java.time.Duration;

public record RetryDecision(boolean retry, Duration delay, String reason) {

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay, "");
    }

    public static RetryDecision giveUp(String reason) {
        return new RetryDecision(false, Duration.ZERO, reason);
    }
}
