package io.kairos.core.execution;

import io.kairos.core.error.NotFoundException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryExecutionStore implements ExecutionStore {
    private static final Comparator<JobExecution> NEWEST_FIRST =
        Comparator.comparing(JobExecution::createdAt).reversed().thenComparing(JobExecution::id);

    private final Map<String, JobExecution> executions = new ConcurrentHashMap<>();

    @Override
    public String append(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        if (executions.putIfAbsent(execution.id(), execution) != null) {
            throw new IllegalStateException("Execution already exists: " + execution.id());
        }
        return execution.id();
    }

    @Override
    public JobExecution update(String id, ExecutionPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        JobExecution updated = executions.computeIfPresent(id, (key, current) -> patch.applyTo(current));
        if (updated == null) {
            throw NotFoundException.execution(id);
        }
        return updated;
    }

    @Override
    public Optional<JobExecution> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(executions.get(id));
    }

    @Override
    public List<JobExecution> listByJob(String jobId, int limit) {
        return executions.values().stream()
            .filter(execution -> execution.jobId().equals(jobId))
            .sorted(NEWEST_FIRST)
            .limit(limit <= 0 ? Long.MAX_VALUE : limit)
            .toList();
    }

    @Override
    public List<JobExecution> listStartedSince(Instant since) {
        return executions.values().stream()
            .filter(execution -> execution.startedAt() != null && !execution.startedAt().isBefore(since))
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public List<JobExecution> listUnfinished() {
        return executions.values().stream()
            .filter(execution -> !execution.status().isTerminal())
            .sorted(Comparator.comparing(JobExecution::createdAt).thenComparing(JobExecution::id))
            .toList();
    }
}
