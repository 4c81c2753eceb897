package io.kairos.core.job;

import io.kairos.core.error.NotFoundException;
import io.kairos.core.error.ValidationException;
import io.kairos.core.schedule.JobSchedule;
import io.kairos.core.schedule.ScheduleCalculator;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-facing job authoring: validates definitions, assigns identity and keeps {@code nextRun}
 * consistent with the schedule and the enabled flag.
 */
public final class JobService {
    private static final Logger LOG = LoggerFactory.getLogger(JobService.class);

    private final JobStore store;
    private final JobValidator validator;
    private final ScheduleCalculator calculator;
    private final Clock clock;

    public JobService(JobStore store, JobValidator validator, ScheduleCalculator calculator, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Job create(JobDefinition definition) throws IOException {
        validator.validate(definition);
        Instant now = now();
        boolean enabled = definition.enabledOrDefault();
        Instant nextRun = enabled
            ? calculator.computeNextRun(definition.schedule(), now, now, null).orElse(null)
            : null;
        Job job = new Job(
            UUID.randomUUID().toString(),
            definition.ownerId(),
            definition.name().trim(),
            definition.description(),
            definition.schedule(),
            definition.action(),
            enabled,
            definition.metadata(),
            null,
            nextRun,
            now,
            now
        );
        Job created = store.create(job);
        LOG.info("Created {} job {} ({}), next run {}", created.type(), created.id(), created.name(), nextRun);
        return created;
    }

    public Job update(String id, JobUpdate update) throws IOException {
        Objects.requireNonNull(update, "update must not be null");
        Job current = get(id);
        if (update.name() != null && update.name().isBlank()) {
            throw new ValidationException("name must not be blank");
        }
        if (update.schedule() != null || update.action() != null) {
            JobDefinition merged = new JobDefinition(
                current.ownerId(),
                update.name() != null ? update.name() : current.name(),
                current.description(),
                update.schedule() != null ? update.schedule() : current.schedule(),
                update.action() != null ? update.action() : current.action(),
                current.metadata(),
                current.enabled()
            );
            validator.validate(merged);
        }

        JobPatch.Builder patch = JobPatch.builder()
            .name(update.name() == null ? null : update.name().trim())
            .description(update.description())
            .schedule(update.schedule())
            .action(update.action())
            .metadata(update.metadata())
            .enabled(update.enabled());
        if (update.changesTiming()) {
            boolean enabled = update.enabled() != null ? update.enabled() : current.enabled();
            patch.nextRun(enabled ? recompute(current, update.schedule()) : null);
        }
        Job updated = store.update(id, patch.build());
        LOG.info("Updated job {} (enabled={}, next run {})", id, updated.enabled(), updated.nextRun());
        return updated;
    }

    public Job setEnabled(String id, boolean enabled) throws IOException {
        return update(id, JobUpdate.enabled(enabled));
    }

    public boolean delete(String id) throws IOException {
        boolean deleted = store.delete(id);
        if (deleted) {
            LOG.info("Deleted job {}", id);
        }
        return deleted;
    }

    public Job get(String id) throws IOException {
        return store.get(id).orElseThrow(() -> NotFoundException.job(id));
    }

    public List<Job> list(JobFilter filter) throws IOException {
        return store.find(filter == null ? JobFilter.all() : filter);
    }

    private Instant recompute(Job current, JobSchedule replacement) {
        JobSchedule schedule = replacement != null ? replacement : current.schedule();
        return calculator.computeNextRun(schedule, current.createdAt(), now(), current.lastRun()).orElse(null);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
