package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.JobSchedule;

/**
 * Everything a caller supplies to create a job; identity, timestamps and {@code nextRun} are
 * assigned on creation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDefinition(
    String ownerId,
    String name,
    String description,
    JobSchedule schedule,
    JobAction action,
    Attributes metadata,
    Boolean enabled
) {
    public JobDefinition {
        metadata = metadata == null ? Attributes.empty() : metadata;
    }

    public static JobDefinition of(String ownerId, String name, JobSchedule schedule, JobAction action) {
        return new JobDefinition(ownerId, name, null, schedule, action, null, true);
    }

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }
}
