package io.kairos.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.error.ErrorCode;
import io.kairos.core.error.NotFoundException;
import io.kairos.core.error.ValidationException;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.JobDefinition;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.CronSchedule;
import io.kairos.core.schedule.IntervalSchedule;
import io.kairos.core.schedule.RecurrenceFrequency;
import io.kairos.core.schedule.RecurringSchedule;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateInstantiatorTest {
    private final InMemoryTemplateCatalog catalog = InMemoryTemplateCatalog.defaults();
    private final TemplateInstantiator instantiator = new TemplateInstantiator(catalog);

    @Test
    void shouldListTemplatesMostPopularFirst() {
        assertThat(catalog.list(null)).extracting(JobTemplate::id).containsExactly(
            "reminder-digest", "daily-summary", "weekly-review", "integration-sync", "task-cleanup"
        );
        assertThat(catalog.list("Maintenance")).extracting(JobTemplate::id).containsExactly("task-cleanup");
        assertThat(catalog.find("nope")).isEmpty();
    }

    @Test
    void shouldOverrideIntervalFromTemplate() {
        JobDefinition definition = instantiator.instantiate(
            "integration-sync",
            TemplateOverrides.forOwner("owner-1").withSchedule(Attributes.of("intervalMinutes", 5))
        );

        assertThat(definition.schedule()).isInstanceOf(IntervalSchedule.class);
        assertThat(((IntervalSchedule) definition.schedule()).intervalMinutes()).isEqualTo(5);
        assertThat(definition.action().type()).isEqualTo(ActionType.SYNC_INTEGRATION);
        assertThat(definition.ownerId()).isEqualTo("owner-1");
        assertThat(definition.metadata().string("templateId")).contains("integration-sync");
    }

    @Test
    void shouldKeepTemplateValuesWithoutOverrides() {
        JobDefinition definition = instantiator.instantiate("weekly-review", null);

        RecurringSchedule schedule = (RecurringSchedule) definition.schedule();
        assertThat(schedule.frequency()).isEqualTo(RecurrenceFrequency.WEEKLY);
        assertThat(schedule.daysOfWeek()).containsExactly(5);
        assertThat(schedule.time()).isEqualTo("16:00");
        assertThat(definition.name()).isEqualTo("Weekly Review");
        assertThat(definition.action().parameters().string("format")).contains("pdf");
        assertThat(definition.enabledOrDefault()).isTrue();
    }

    @Test
    void shouldMergeNestedActionParameters() {
        TemplateOverrides overrides = new TemplateOverrides(
            "owner-1",
            "Archive old tasks",
            null,
            null,
            Attributes.of("parameters", Map.of("olderThanDays", 90)),
            Attributes.of("team", "ops"),
            false
        );

        JobDefinition definition = instantiator.instantiate("task-cleanup", overrides);

        assertThat(definition.name()).isEqualTo("Archive old tasks");
        assertThat(definition.action().parameters().integer("olderThanDays")).contains(90L);
        assertThat(definition.action().parameters().bool("cleanCompletedTasks", false)).isTrue();
        assertThat(definition.metadata().asMap()).containsEntry("team", "ops").containsEntry("templateId", "task-cleanup");
        assertThat(definition.enabledOrDefault()).isFalse();
    }

    @Test
    void shouldReplaceScheduleWhenOverrideChangesType() {
        JobDefinition definition = instantiator.instantiate(
            "daily-summary",
            TemplateOverrides.none().withSchedule(Attributes.of(Map.of("type", "CRON", "cronExpression", "0 7 * * 1-5")))
        );

        assertThat(definition.schedule()).isEqualTo(new CronSchedule("0 7 * * 1-5", null, null, null));
    }

    @Test
    void shouldReportUnknownTemplate() {
        assertThatThrownBy(() -> instantiator.instantiate("missing", null))
            .isInstanceOfSatisfying(NotFoundException.class, error -> assertThat(error.code()).isEqualTo(ErrorCode.TEMPLATE_NOT_FOUND));
    }

    @Test
    void shouldRejectUnbindableSchedule() {
        TemplateOverrides overrides = TemplateOverrides.none().withSchedule(Attributes.of("type", "SOMETIMES"));

        assertThatThrownBy(() -> instantiator.instantiate("daily-summary", overrides))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("invalid schedule");
    }

    @Test
    void shouldExposeTagsOfTemplate() {
        assertThat(catalog.find("reminder-digest").orElseThrow().tags()).isNotEmpty();
        assertThat(List.copyOf(catalog.list("notifications"))).hasSize(2);
    }
}
