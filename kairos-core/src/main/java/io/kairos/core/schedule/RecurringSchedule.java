package io.kairos.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;

/**
 * Calendar recurrence. {@code daysOfWeek} uses 0-6 (Sunday-Saturday), {@code daysOfMonth} 1-31,
 * {@code monthsOfYear} 1-12 and {@code time} is {@code HH:mm} in {@code timezone}.
 * {@code interval} is only read by {@link RecurrenceFrequency#CUSTOM} without calendar constraints,
 * where it is a period in minutes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecurringSchedule(
    RecurrenceFrequency frequency,
    List<Integer> daysOfWeek,
    List<Integer> daysOfMonth,
    List<Integer> monthsOfYear,
    String time,
    Integer interval,
    Instant startDate,
    Instant endDate,
    String timezone
) implements JobSchedule {

    public RecurringSchedule {
        daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
        daysOfMonth = daysOfMonth == null ? List.of() : List.copyOf(daysOfMonth);
        monthsOfYear = monthsOfYear == null ? List.of() : List.copyOf(monthsOfYear);
    }

    public static RecurringSchedule daily(String time, String timezone) {
        return new RecurringSchedule(RecurrenceFrequency.DAILY, null, null, null, time, null, null, null, timezone);
    }

    public static RecurringSchedule weekly(List<Integer> daysOfWeek, String time, String timezone) {
        return new RecurringSchedule(RecurrenceFrequency.WEEKLY, daysOfWeek, null, null, time, null, null, null, timezone);
    }

    public static RecurringSchedule monthly(List<Integer> daysOfMonth, String time, String timezone) {
        return new RecurringSchedule(RecurrenceFrequency.MONTHLY, null, daysOfMonth, null, time, null, null, null, timezone);
    }

    public boolean hasCalendarConstraints() {
        return !daysOfWeek.isEmpty() || !daysOfMonth.isEmpty() || !monthsOfYear.isEmpty();
    }

    @Override
    public JobType type() {
        return JobType.RECURRING;
    }
}
