package io.kairos.core.template;

import io.kairos.core.model.Attributes;
import java.util.List;
import java.util.Objects;

/**
 * Read-only catalog entry. {@code schedule} and {@code action} are partial: they hold whatever
 * fields the template fixes and are completed by the caller on instantiation.
 */
public record JobTemplate(
    String id,
    String name,
    String description,
    String category,
    Attributes schedule,
    Attributes action,
    int popularity,
    List<String> tags
) {
    public JobTemplate {
        Objects.requireNonNull(id, "id must not be null");
        schedule = schedule == null ? Attributes.empty() : schedule;
        action = action == null ? Attributes.empty() : action;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
