package io.kairos.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;

/**
 * When a job fires. One variant per {@link JobType}; the JSON {@code type} property selects it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OneTimeSchedule.class, name = "ONE_TIME"),
    @JsonSubTypes.Type(value = RecurringSchedule.class, name = "RECURRING"),
    @JsonSubTypes.Type(value = CronSchedule.class, name = "CRON"),
    @JsonSubTypes.Type(value = IntervalSchedule.class, name = "INTERVAL"),
    @JsonSubTypes.Type(value = DelayedSchedule.class, name = "DELAYED")
})
public sealed interface JobSchedule
    permits OneTimeSchedule, RecurringSchedule, CronSchedule, IntervalSchedule, DelayedSchedule {

    @JsonIgnore
    JobType type();

    Instant startDate();

    Instant endDate();

    String timezone();
}
