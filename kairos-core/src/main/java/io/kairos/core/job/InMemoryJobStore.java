package io.kairos.core.job;

import io.kairos.core.error.NotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public final class InMemoryJobStore implements JobStore {
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<Job> find(JobFilter filter) {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
            .filter(effective::matches)
            .sorted(ordering(effective))
            .limit(effective.limit())
            .toList();
    }

    @Override
    public Optional<Job> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Job create(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Job existing = jobs.putIfAbsent(job.id(), job);
        if (existing != null) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
        return job;
    }

    @Override
    public Job update(String id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        Job updated = jobs.computeIfPresent(id, (key, current) -> patch.applyTo(current, clock.instant()));
        if (updated == null) {
            throw NotFoundException.job(id);
        }
        return updated;
    }

    @Override
    public boolean delete(String id) {
        return id != null && jobs.remove(id) != null;
    }

    @Override
    public boolean tryClaim(String id, Instant expectedNextRun, Instant newNextRun) {
        if (id == null) {
            return false;
        }
        AtomicBoolean claimed = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.enabled() || !Objects.equals(current.nextRun(), expectedNextRun)) {
                return current;
            }
            claimed.set(true);
            return current.withNextRun(newNextRun, clock.instant());
        });
        return claimed.get();
    }

    static Comparator<Job> ordering(JobFilter filter) {
        if (filter.dueAt() != null) {
            return Comparator.comparing(Job::nextRun, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Job::id);
        }
        return Comparator.comparing(Job::createdAt).reversed().thenComparing(Job::id);
    }
}
