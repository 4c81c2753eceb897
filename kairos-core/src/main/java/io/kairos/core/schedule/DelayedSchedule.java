package io.kairos.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Fires once, {@code delayMinutes} after the job was created.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DelayedSchedule(
    Integer delayMinutes,
    Instant startDate,
    Instant endDate,
    String timezone
) implements JobSchedule {

    public static DelayedSchedule after(int delayMinutes) {
        return new DelayedSchedule(delayMinutes, null, null, null);
    }

    @Override
    public JobType type() {
        return JobType.DELAYED;
    }
}
