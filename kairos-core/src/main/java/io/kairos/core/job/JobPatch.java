package io.kairos.core.job;

import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.JobSchedule;
import java.time.Instant;

/**
 * Store-level partial write. Unset fields keep their stored value; {@code nextRun} and
 * {@code lastRun} can be explicitly set to {@code null}.
 */
public final class JobPatch {
    private final String name;
    private final String description;
    private final JobSchedule schedule;
    private final JobAction action;
    private final Attributes metadata;
    private final Boolean enabled;
    private final boolean lastRunSet;
    private final Instant lastRun;
    private final boolean nextRunSet;
    private final Instant nextRun;

    private JobPatch(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.schedule = builder.schedule;
        this.action = builder.action;
        this.metadata = builder.metadata;
        this.enabled = builder.enabled;
        this.lastRunSet = builder.lastRunSet;
        this.lastRun = builder.lastRun;
        this.nextRunSet = builder.nextRunSet;
        this.nextRun = builder.nextRun;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JobPatch lastRun(Instant lastRun) {
        return builder().lastRun(lastRun).build();
    }

    public boolean setsEnabled() {
        return enabled != null;
    }

    public boolean setsLastRun() {
        return lastRunSet;
    }

    public boolean setsNextRun() {
        return nextRunSet;
    }

    public Job applyTo(Job job, Instant updatedAt) {
        return new Job(
            job.id(),
            job.ownerId(),
            name != null ? name : job.name(),
            description != null ? description : job.description(),
            schedule != null ? schedule : job.schedule(),
            action != null ? action : job.action(),
            enabled != null ? enabled : job.enabled(),
            metadata != null ? metadata : job.metadata(),
            lastRunSet ? lastRun : job.lastRun(),
            nextRunSet ? nextRun : job.nextRun(),
            job.createdAt(),
            updatedAt
        );
    }

    public static final class Builder {
        private String name;
        private String description;
        private JobSchedule schedule;
        private JobAction action;
        private Attributes metadata;
        private Boolean enabled;
        private boolean lastRunSet;
        private Instant lastRun;
        private boolean nextRunSet;
        private Instant nextRun;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder schedule(JobSchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder action(JobAction action) {
            this.action = action;
            return this;
        }

        public Builder metadata(Attributes metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRunSet = true;
            this.lastRun = lastRun;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRunSet = true;
            this.nextRun = nextRun;
            return this;
        }

        public JobPatch build() {
            return new JobPatch(this);
        }
    }
}
