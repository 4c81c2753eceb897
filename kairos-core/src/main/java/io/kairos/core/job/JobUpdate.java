package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.JobSchedule;

/**
 * Caller-side partial update; {@code null} fields are left unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobUpdate(
    String name,
    String description,
    JobSchedule schedule,
    JobAction action,
    Attributes metadata,
    Boolean enabled
) {

    public static JobUpdate schedule(JobSchedule schedule) {
        return new JobUpdate(null, null, schedule, null, null, null);
    }

    public static JobUpdate enabled(boolean enabled) {
        return new JobUpdate(null, null, null, null, null, enabled);
    }

    public boolean changesTiming() {
        return schedule != null || enabled != null;
    }
}
