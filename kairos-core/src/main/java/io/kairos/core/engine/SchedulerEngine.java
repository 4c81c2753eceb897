package io.kairos.core.engine;

import io.kairos.core.action.ActionHandlerRegistry;
import io.kairos.core.error.NotFoundException;
import io.kairos.core.execution.ExecutionStore;
import io.kairos.core.execution.JobExecution;
import io.kairos.core.job.JobStore;
import io.kairos.core.model.Attributes;
import io.kairos.core.retry.RetryPolicyEvaluator;
import io.kairos.core.schedule.ScheduleCalculator;
import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One scheduler instance: a dispatcher feeding an executor. Nothing runs until {@link #start()}.
 */
public final class SchedulerEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerEngine.class);

    private final JobStore jobStore;
    private final JobExecutor executor;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private boolean started;

    public SchedulerEngine(
        JobStore jobStore,
        ExecutionStore executionStore,
        ActionHandlerRegistry handlers,
        ScheduleCalculator calculator,
        Clock clock,
        SchedulerSettings settings
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.executor = new JobExecutor(jobStore, executionStore, handlers, new RetryPolicyEvaluator(), clock, settings);
        this.dispatcher = new JobDispatcher(
            jobStore,
            calculator,
            executor,
            clock,
            settings.missedRunPolicy(),
            settings.tickInterval()
        );
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        dispatcher.start();
        started = true;
        LOG.info("Scheduler engine started");
    }

    public synchronized boolean isRunning() {
        return started;
    }

    /**
     * Runs one dispatch cycle immediately, regardless of whether the engine was started.
     */
    public int tick() throws IOException {
        return dispatcher.tick();
    }

    /**
     * Queues a manual run of the job. The job's {@code nextRun} is not touched.
     *
     * @param overrides merged over the action parameters for this run only
     */
    public JobExecution executeNow(String jobId, Attributes overrides) throws IOException {
        jobStore.get(jobId).orElseThrow(() -> NotFoundException.job(jobId));
        JobExecution execution = executor.submit(Occurrence.manual(jobId, clock.instant(), overrides));
        LOG.info("Manual run of job {} queued as execution {}", jobId, execution.id());
        return execution;
    }

    public boolean cancel(String executionId) throws IOException {
        return executor.cancel(executionId);
    }

    public boolean isTracking(String executionId) {
        return executor.isTracking(executionId);
    }

    public int activeExecutions() {
        return executor.activeCount();
    }

    public int queuedExecutions() {
        return executor.queuedCount();
    }

    @Override
    public synchronized void close() {
        dispatcher.close();
        executor.close();
        started = false;
        LOG.info("Scheduler engine stopped");
    }
}
