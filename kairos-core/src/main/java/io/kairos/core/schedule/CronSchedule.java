package io.kairos.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronSchedule(
    String cronExpression,
    Instant startDate,
    Instant endDate,
    String timezone
) implements JobSchedule {

    public static CronSchedule of(String cronExpression, String timezone) {
        return new CronSchedule(cronExpression, null, null, timezone);
    }

    @Override
    public JobType type() {
        return JobType.CRON;
    }
}
