package io.kairos.core.engine;

import io.kairos.core.job.Job;
import io.kairos.core.job.JobFilter;
import io.kairos.core.job.JobStore;
import io.kairos.core.schedule.ScheduleCalculator;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically claims due jobs and hands each claimed occurrence to an {@link OccurrenceSink}.
 *
 * <p>A claim is a compare-and-set on the job's {@code nextRun}; the new value is computed before
 * the occurrence runs, so a job's cadence does not depend on how long its executions take.
 */
public final class JobDispatcher implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore jobStore;
    private final ScheduleCalculator calculator;
    private final OccurrenceSink sink;
    private final Clock clock;
    private final MissedRunPolicy missedRunPolicy;
    private final Duration tickInterval;
    private ScheduledExecutorService timer;

    public JobDispatcher(
        JobStore jobStore,
        ScheduleCalculator calculator,
        OccurrenceSink sink,
        Clock clock,
        MissedRunPolicy missedRunPolicy,
        Duration tickInterval
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.missedRunPolicy = missedRunPolicy == null ? MissedRunPolicy.COALESCE : missedRunPolicy;
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
    }

    public synchronized void start() {
        if (timer != null) {
            throw new IllegalStateException("Dispatcher already started");
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kairos-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        timer.scheduleAtFixedRate(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Dispatcher started, tick every {} ms ({} missed runs)", tickInterval.toMillis(), missedRunPolicy);
    }

    /**
     * Runs one dispatch cycle.
     *
     * @return the number of occurrences claimed in this cycle
     * @throws IOException if the due-job query fails; nothing is claimed in that case
     */
    public int tick() throws IOException {
        Instant now = clock.instant();
        List<Job> due = jobStore.find(JobFilter.due(now));
        int claimed = 0;
        for (Job job : due) {
            try {
                if (claim(job, now)) {
                    claimed++;
                }
            } catch (Exception e) {
                LOG.error("Failed to dispatch job {}; leaving it for the next tick", job.id(), e);
            }
        }
        if (claimed > 0) {
            LOG.debug("Dispatch tick claimed {} of {} due jobs", claimed, due.size());
        }
        return claimed;
    }

    private boolean claim(Job job, Instant now) throws IOException {
        Instant expected = job.nextRun();
        Instant reference = missedRunPolicy.referenceFor(expected, now);
        Instant next = calculator.computeNextRun(job.schedule(), job.createdAt(), reference, expected).orElse(null);
        if (!jobStore.tryClaim(job.id(), expected, next)) {
            LOG.debug("Lost claim on job {} for {}", job.id(), expected);
            return false;
        }
        if (next == null) {
            LOG.info("Schedule of job {} is exhausted after {}", job.id(), expected);
        }
        sink.submit(Occurrence.scheduled(job.id(), expected));
        return true;
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            LOG.error("Dispatch tick failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (timer == null) {
            return;
        }
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Dispatcher did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timer = null;
        LOG.info("Dispatcher stopped");
    }
}
