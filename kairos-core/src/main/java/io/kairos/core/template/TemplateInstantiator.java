package io.kairos.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.error.NotFoundException;
import io.kairos.core.error.ValidationException;
import io.kairos.core.job.JobAction;
import io.kairos.core.job.JobDefinition;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.JobSchedule;
import java.util.Objects;

/**
 * Builds job definitions from catalog templates. The result is not validated here; it goes through
 * the same validation as any other definition when the job is created.
 */
public final class TemplateInstantiator {
    private final TemplateCatalog catalog;
    private final ObjectMapper mapper;

    public TemplateInstantiator(TemplateCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    /**
     * @throws NotFoundException if the template does not exist
     * @throws ValidationException if the merged schedule or action cannot be bound at all
     */
    public JobDefinition instantiate(String templateId, TemplateOverrides overrides) {
        JobTemplate template = catalog.find(templateId).orElseThrow(() -> NotFoundException.template(templateId));
        TemplateOverrides effective = overrides == null ? TemplateOverrides.none() : overrides;

        JsonNode scheduleNode = mergeSchedule(tree(template.schedule()), tree(effective.schedule()));
        JsonNode actionNode = deepMerge(tree(template.action()), tree(effective.action()));
        JobSchedule schedule = bind(scheduleNode, JobSchedule.class, "schedule");
        JobAction action = bind(actionNode, JobAction.class, "action");

        String name = effective.name() != null && !effective.name().isBlank() ? effective.name() : template.name();
        String description = effective.description() != null ? effective.description() : template.description();
        Attributes metadata = effective.metadata().with("templateId", template.id());
        return new JobDefinition(effective.ownerId(), name, description, schedule, action, metadata, effective.enabled());
    }

    private JsonNode mergeSchedule(JsonNode template, JsonNode override) {
        JsonNode templateType = template.get("type");
        JsonNode overrideType = override.get("type");
        if (templateType != null && overrideType != null
            && !templateType.asText().equalsIgnoreCase(overrideType.asText())) {
            // a different schedule kind shares no fields with the template's
            return override;
        }
        return deepMerge(template, override);
    }

    private JsonNode tree(Attributes attributes) {
        return mapper.valueToTree(attributes.asMap());
    }

    private <T> T bind(JsonNode node, Class<T> type, String field) {
        if (node == null || node.isEmpty()) {
            throw new ValidationException(field + " is required");
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("invalid " + field + ": " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid " + field + ": " + e.getMessage());
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
