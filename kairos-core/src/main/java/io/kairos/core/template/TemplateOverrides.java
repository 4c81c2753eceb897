package io.kairos.core.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.model.Attributes;

/**
 * Caller values applied over a template. {@code schedule} and {@code action} are partial objects
 * in the same JSON shape as a job's schedule and action.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateOverrides(
    String ownerId,
    String name,
    String description,
    Attributes schedule,
    Attributes action,
    Attributes metadata,
    Boolean enabled
) {
    public TemplateOverrides {
        schedule = schedule == null ? Attributes.empty() : schedule;
        action = action == null ? Attributes.empty() : action;
        metadata = metadata == null ? Attributes.empty() : metadata;
    }

    public static TemplateOverrides none() {
        return new TemplateOverrides(null, null, null, null, null, null, null);
    }

    public static TemplateOverrides forOwner(String ownerId) {
        return new TemplateOverrides(ownerId, null, null, null, null, null, null);
    }

    public TemplateOverrides withSchedule(Attributes schedule) {
        return new TemplateOverrides(ownerId, name, description, schedule, action, metadata, enabled);
    }

    public TemplateOverrides withAction(Attributes action) {
        return new TemplateOverrides(ownerId, name, description, schedule, action, metadata, enabled);
    }
}
