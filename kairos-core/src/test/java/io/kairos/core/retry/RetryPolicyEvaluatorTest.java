package io.kairos.core.retry;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyEvaluatorTest {
    private final RetryPolicyEvaluator evaluator = new RetryPolicyEvaluator();

    @Test
    void shouldGrowDelayExponentiallyUpToCap() {
        RetryPolicy policy = RetryPolicy.exponential(5, 1000, 2.0, 10_000);

        assertThat(evaluator.delaySchedule(policy)).containsExactly(1000L, 2000L, 4000L, 8000L, 10_000L);
    }

    @Test
    void shouldUseConstantDelayWithoutMultiplier() {
        RetryPolicy policy = new RetryPolicy(3, 500, null, null);

        assertThat(evaluator.delaySchedule(policy)).containsExactly(500L, 500L, 500L);
    }

    @Test
    void shouldRetryUntilMaxRetriesReached() {
        RetryPolicy policy = RetryPolicy.exponential(2, 100, 3.0, 10_000);

        RetryDecision first = evaluator.evaluate(policy, true, 0);
        RetryDecision second = evaluator.evaluate(policy, true, 1);
        RetryDecision third = evaluator.evaluate(policy, true, 2);

        assertThat(first.retry()).isTrue();
        assertThat(first.delay()).isEqualTo(Duration.ofMillis(100));
        assertThat(second.delay()).isEqualTo(Duration.ofMillis(300));
        assertThat(third.retry()).isFalse();
        assertThat(third.reason()).contains("exhausted");
    }

    @Test
    void shouldNeverRetryNonRetryableErrors() {
        RetryDecision decision = evaluator.evaluate(RetryPolicy.exponential(5, 100, 2.0, 1000), false, 0);

        assertThat(decision.retry()).isFalse();
    }

    @Test
    void shouldGiveUpWithoutPolicy() {
        assertThat(evaluator.evaluate(null, true, 0).retry()).isFalse();
        assertThat(evaluator.evaluate(RetryPolicy.none(), true, 0).retry()).isFalse();
    }
}
