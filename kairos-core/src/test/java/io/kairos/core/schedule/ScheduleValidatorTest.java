package io.kairos.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.error.ErrorCode;
import io.kairos.core.error.ValidationException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScheduleValidatorTest {
    private final ScheduleValidator validator = new ScheduleValidator(new CronExpressions());

    @Test
    void shouldAcceptWellFormedSchedules() {
        assertThat(validator.violations(CronSchedule.of("0 9 * * MON-FRI", "Europe/Berlin"))).isEmpty();
        assertThat(validator.violations(IntervalSchedule.every(30))).isEmpty();
        assertThat(validator.violations(RecurringSchedule.weekly(List.of(1, 5), "08:30", null))).isEmpty();
    }

    @Test
    void shouldReportEveryViolation() {
        RecurringSchedule schedule = new RecurringSchedule(
            RecurrenceFrequency.WEEKLY,
            List.of(7),
            null,
            List.of(13),
            "25:00",
            null,
            null,
            null,
            "Mars/Olympus"
        );

        assertThat(validator.violations(schedule))
            .hasSize(4)
            .anyMatch(message -> message.startsWith("time must be HH:mm"))
            .anyMatch(message -> message.startsWith("daysOfWeek"))
            .anyMatch(message -> message.startsWith("monthsOfYear"))
            .anyMatch(message -> message.startsWith("unknown timezone"));
    }

    @Test
    void shouldRejectDaysNoListedMonthCanHold() {
        RecurringSchedule february30 = new RecurringSchedule(
            RecurrenceFrequency.YEARLY, null, List.of(30), List.of(2), "09:00", null, null, null, null
        );
        RecurringSchedule aprilOrJune31 = new RecurringSchedule(
            RecurrenceFrequency.CUSTOM, null, List.of(31), List.of(4, 6), null, null, null, null, null
        );

        List<String> violations = validator.violations(february30);
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0)).startsWith("no month in monthsOfYear");
        assertThat(validator.violations(aprilOrJune31)).hasSize(1);
    }

    @Test
    void shouldAcceptLeapDayAndMixedMonthLengths() {
        RecurringSchedule leapDay = new RecurringSchedule(
            RecurrenceFrequency.CUSTOM, List.of(1), List.of(29), List.of(2), "09:00", null, null, null, null
        );
        RecurringSchedule monthEnd = new RecurringSchedule(
            RecurrenceFrequency.YEARLY, null, List.of(31), List.of(2, 3), null, null, null, null, null
        );

        assertThat(validator.violations(leapDay)).isEmpty();
        assertThat(validator.violations(monthEnd)).isEmpty();
    }

    @Test
    void shouldRejectCronWithWrongFieldCount() {
        List<String> violations = validator.violations(CronSchedule.of("0 0 9 * * ?", null));

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0)).contains("5 fields");
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> validator.validate(IntervalSchedule.every(0)))
            .isInstanceOfSatisfying(ValidationException.class, error -> {
                assertThat(error.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                assertThat(error.violations()).containsExactly("intervalMinutes must be > 0");
            });
    }

    @Test
    void shouldRejectStartDateAfterEndDate() {
        IntervalSchedule schedule = new IntervalSchedule(
            10,
            Instant.parse("2026-02-01T00:00:00Z"),
            Instant.parse("2026-01-01T00:00:00Z"),
            null
        );

        assertThat(validator.violations(schedule)).containsExactly("startDate must be before endDate");
    }

    @Test
    void shouldRequireCustomRecurrenceToHaveConstraintsOrInterval() {
        RecurringSchedule custom = new RecurringSchedule(
            RecurrenceFrequency.CUSTOM, null, null, null, null, null, null, null, null
        );

        assertThat(validator.violations(custom)).hasSize(1);
    }
}
