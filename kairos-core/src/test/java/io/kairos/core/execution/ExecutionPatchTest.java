package io.kairos.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.model.Attributes;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ExecutionPatchTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final JobExecution pending = JobExecution.pending("exec-1", "job-1", ExecutionTrigger.SCHEDULED, T0, T0);

    @Test
    void shouldStampStartAndCompletionTimes() {
        JobExecution running = ExecutionPatch.running(T0.plusSeconds(1)).applyTo(pending);
        JobExecution completed = ExecutionPatch.completed(Attributes.of("status", 200), T0.plusSeconds(3)).applyTo(running);

        assertThat(running.startedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(running.completedAt()).isNull();
        assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(completed.completedAt()).isEqualTo(T0.plusSeconds(3));
        assertThat(completed.durationMs()).isEqualTo(2000L);
        assertThat(completed.result().integer("status")).contains(200L);
    }

    @Test
    void shouldKeepFirstStartAndCountRetries() {
        ExecutionError timeout = new ExecutionError(ExecutionError.EXECUTION_TIMEOUT, "timed out", true);
        JobExecution running = ExecutionPatch.running(T0.plusSeconds(1)).applyTo(pending);
        JobExecution retrying = ExecutionPatch.retrying(timeout, T0.plusSeconds(2)).applyTo(running);
        JobExecution rerun = ExecutionPatch.running(T0.plusSeconds(5)).applyTo(retrying);
        JobExecution completed = ExecutionPatch.completed(null, T0.plusSeconds(6)).applyTo(rerun);

        assertThat(retrying.retryCount()).isEqualTo(1);
        assertThat(retrying.completedAt()).isNull();
        assertThat(rerun.startedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(rerun.error()).isEqualTo(timeout);
        assertThat(completed.error()).isNull();
        assertThat(completed.retryCount()).isEqualTo(1);
    }

    @Test
    void shouldCancelPendingExecutionWithoutStartTime() {
        JobExecution cancelled = ExecutionPatch.cancelled("user request", T0.plusSeconds(1)).applyTo(pending);

        assertThat(cancelled.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(cancelled.startedAt()).isNull();
        assertThat(cancelled.completedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(cancelled.error().code()).isEqualTo(ExecutionError.CANCELLED);
        assertThat(cancelled.durationMs()).isNull();
    }

    @Test
    void shouldRejectTransitionsOutOfTerminalStates() {
        JobExecution failed = ExecutionPatch.failed(
            new ExecutionError(ExecutionError.HANDLER_ERROR, "boom", false),
            T0
        ).applyTo(ExecutionPatch.running(T0).applyTo(pending));

        assertThatThrownBy(() -> ExecutionPatch.running(T0).applyTo(failed)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ExecutionPatch.completed(null, T0).applyTo(pending)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDescribeStatusLifecycle() {
        assertThat(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING)).isTrue();
        assertThat(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.RETRYING)).isTrue();
        assertThat(ExecutionStatus.RETRYING.canTransitionTo(ExecutionStatus.COMPLETED)).isFalse();
        assertThat(ExecutionStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(ExecutionStatus.RETRYING.isActive()).isTrue();
    }
}
