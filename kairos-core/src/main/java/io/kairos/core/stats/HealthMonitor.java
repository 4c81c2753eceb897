package io.kairos.core.stats;

import io.kairos.core.error.NotFoundException;
import io.kairos.core.execution.ExecutionError;
import io.kairos.core.execution.ExecutionPatch;
import io.kairos.core.execution.ExecutionStatus;
import io.kairos.core.execution.ExecutionStore;
import io.kairos.core.execution.JobExecution;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobPatch;
import io.kairos.core.job.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic housekeeping over the stores.
 *
 * <p>Executions left unfinished longer than {@code stuckAfter} and not tracked by the local executor
 * (typically after a restart) are closed: PENDING ones as CANCELLED, RUNNING and RETRYING ones as
 * FAILED with {@code EXECUTION_TIMEOUT}. Enabled jobs that failed more than {@code maxFailures}
 * times inside {@code failureWindow} are disabled and tagged with {@code disabledReason}.
 */
public final class HealthMonitor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

    private final JobStore jobStore;
    private final ExecutionStore executionStore;
    private final Clock clock;
    private final HealthSettings settings;
    private final Predicate<String> inFlight;
    private ScheduledExecutorService timer;

    /**
     * @param inFlight tells whether the local executor still owns an execution id
     */
    public HealthMonitor(
        JobStore jobStore,
        ExecutionStore executionStore,
        Clock clock,
        HealthSettings settings,
        Predicate<String> inFlight
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight must not be null");
    }

    public synchronized void start() {
        if (timer != null) {
            throw new IllegalStateException("Health monitor already started");
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kairos-health");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = settings.checkInterval().toMillis();
        timer.scheduleAtFixedRate(this::safeCheck, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Health monitor started, check every {} ms", periodMs);
    }

    public HealthReport check() throws IOException {
        List<String> swept = sweepStuckExecutions();
        List<String> disabled = disableFailingJobs();
        if (!swept.isEmpty() || !disabled.isEmpty()) {
            LOG.warn("Health check closed {} stuck executions and disabled {} jobs", swept.size(), disabled.size());
        }
        return new HealthReport(clock.instant(), swept, disabled);
    }

    public List<String> sweepStuckExecutions() throws IOException {
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.stuckAfter());
        List<String> swept = new ArrayList<>();
        for (JobExecution execution : executionStore.listUnfinished()) {
            Instant since = execution.startedAt() != null ? execution.startedAt() : execution.createdAt();
            if (since.isAfter(cutoff) || inFlight.test(execution.id())) {
                continue;
            }
            try {
                executionStore.update(execution.id(), closingPatch(execution, now));
            } catch (IllegalStateException e) {
                LOG.debug("Execution {} finished while being swept: {}", execution.id(), e.getMessage());
                continue;
            }
            swept.add(execution.id());
            LOG.warn("Closed execution {} of job {}, left {} since {}", execution.id(), execution.jobId(), execution.status(), since);
            markLastRun(execution.jobId(), now);
        }
        return swept;
    }

    public List<String> disableFailingJobs() throws IOException {
        Instant now = clock.instant();
        Map<String, Integer> failures = new TreeMap<>();
        for (JobExecution execution : executionStore.listStartedSince(now.minus(settings.failureWindow()))) {
            if (execution.status() == ExecutionStatus.FAILED) {
                failures.merge(execution.jobId(), 1, Integer::sum);
            }
        }

        List<String> disabled = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : failures.entrySet()) {
            if (entry.getValue() <= settings.maxFailures()) {
                continue;
            }
            Optional<Job> job = jobStore.get(entry.getKey());
            if (job.isEmpty() || !job.get().enabled()) {
                continue;
            }
            String reason = entry.getValue() + " failed executions within " + settings.failureWindow().toHours() + "h";
            jobStore.update(entry.getKey(), JobPatch.builder()
                .enabled(false)
                .nextRun(null)
                .metadata(job.get().metadata().with("disabledReason", reason))
                .build());
            disabled.add(entry.getKey());
            LOG.warn("Disabled job {} ({}): {}", entry.getKey(), job.get().name(), reason);
        }
        return disabled;
    }

    private ExecutionPatch closingPatch(JobExecution execution, Instant now) {
        if (execution.status() == ExecutionStatus.PENDING) {
            return ExecutionPatch.cancelled("abandoned before start", now);
        }
        return ExecutionPatch.failed(new ExecutionError(
            ExecutionError.EXECUTION_TIMEOUT,
            "Execution abandoned after " + settings.stuckAfter().toMinutes() + " min without finishing",
            true
        ), now);
    }

    private void markLastRun(String jobId, Instant now) {
        try {
            jobStore.update(jobId, JobPatch.lastRun(now));
        } catch (NotFoundException e) {
            LOG.debug("Job {} of a swept execution no longer exists", jobId);
        } catch (IOException e) {
            LOG.error("Failed to record last run of job {}", jobId, e);
        }
    }

    private void safeCheck() {
        try {
            check();
        } catch (Exception e) {
            LOG.error("Health check failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (timer == null) {
            return;
        }
        timer.shutdownNow();
        timer = null;
        LOG.info("Health monitor stopped");
    }
}
