package io.kairos.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OneTimeSchedule(
    Instant runAt,
    Instant startDate,
    Instant endDate,
    String timezone
) implements JobSchedule {

    public static OneTimeSchedule at(Instant runAt) {
        return new OneTimeSchedule(runAt, null, null, null);
    }

    @Override
    public JobType type() {
        return JobType.ONE_TIME;
    }
}
