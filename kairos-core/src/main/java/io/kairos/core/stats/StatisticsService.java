package io.kairos.core.stats;

import io.kairos.core.error.NotFoundException;
import io.kairos.core.execution.ExecutionStatus;
import io.kairos.core.execution.ExecutionStore;
import io.kairos.core.execution.JobExecution;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobFilter;
import io.kairos.core.job.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class StatisticsService {
    private static final Logger LOG = LoggerFactory.getLogger(StatisticsService.class);
    private static final int UPCOMING_LIMIT = 10;

    private final JobStore jobStore;
    private final ExecutionStore executionStore;
    private final Clock clock;
    private final ZoneId zone;

    public StatisticsService(JobStore jobStore, ExecutionStore executionStore, Clock clock, ZoneId zone) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public JobStatistics jobStatistics(String jobId) throws IOException {
        Job job = jobStore.get(jobId).orElseThrow(() -> NotFoundException.job(jobId));
        List<JobExecution> executions = executionStore.listByJob(jobId, 0);

        int successful = count(executions, ExecutionStatus.COMPLETED);
        int failed = count(executions, ExecutionStatus.FAILED);
        Instant lastExecution = executions.stream()
            .map(JobExecution::startedAt)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
        return new JobStatistics(
            jobId,
            executions.size(),
            successful,
            failed,
            executions.isEmpty() ? 0.0 : percentage(successful, executions.size()),
            averageDuration(executions),
            lastExecution,
            job.nextRun()
        );
    }

    /**
     * Computes the scheduler snapshot; a failing store query marks its part unavailable.
     */
    public SchedulerMetrics metrics() {
        List<String> unavailable = new ArrayList<>();

        int totalJobs = 0;
        int activeJobs = 0;
        List<UpcomingJob> upcoming = List.of();
        try {
            List<Job> jobs = jobStore.find(JobFilter.all());
            totalJobs = jobs.size();
            activeJobs = (int) jobs.stream().filter(Job::enabled).count();
            upcoming = jobs.stream()
                .filter(job -> job.enabled() && job.nextRun() != null)
                .sorted(Comparator.comparing(Job::nextRun).thenComparing(Job::id))
                .limit(UPCOMING_LIMIT)
                .map(job -> new UpcomingJob(job.id(), job.name(), job.type(), job.nextRun()))
                .toList();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Job metrics unavailable: {}", e.getMessage());
            unavailable.add("jobs");
        }

        int executionsToday = 0;
        double successRate = 100.0;
        double failureRate = 0.0;
        double averageMs = 0.0;
        try {
            Instant startOfDay = LocalDate.now(clock.withZone(zone)).atStartOfDay(zone).toInstant();
            List<JobExecution> today = executionStore.listStartedSince(startOfDay);
            executionsToday = today.size();
            if (!today.isEmpty()) {
                successRate = percentage(count(today, ExecutionStatus.COMPLETED), today.size());
                failureRate = percentage(count(today, ExecutionStatus.FAILED), today.size());
            }
            averageMs = averageDuration(today);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Execution metrics unavailable: {}", e.getMessage());
            unavailable.add("executions");
        }

        return new SchedulerMetrics(
            totalJobs,
            activeJobs,
            totalJobs - activeJobs,
            executionsToday,
            successRate,
            failureRate,
            averageMs,
            upcoming,
            unavailable
        );
    }

    private static int count(List<JobExecution> executions, ExecutionStatus status) {
        return (int) executions.stream().filter(execution -> execution.status() == status).count();
    }

    private static double averageDuration(List<JobExecution> executions) {
        return executions.stream()
            .filter(execution -> execution.status() == ExecutionStatus.COMPLETED)
            .map(JobExecution::durationMs)
            .filter(Objects::nonNull)
            .mapToLong(Long::longValue)
            .average()
            .orElse(0.0);
    }

    private static double percentage(int part, int total) {
        return Math.round(part * 10_000.0 / total) / 100.0;
    }
}
