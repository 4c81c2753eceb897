package io.kairos.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IntervalSchedule(
    Integer intervalMinutes,
    Instant startDate,
    Instant endDate,
    String timezone
) implements JobSchedule {

    public static IntervalSchedule every(int intervalMinutes) {
        return new IntervalSchedule(intervalMinutes, null, null, null);
    }

    @Override
    public JobType type() {
        return JobType.INTERVAL;
    }
}
