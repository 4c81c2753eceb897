package io.kairos.core.schedule;

import io.kairos.core.error.ValidationException;
import java.time.DateTimeException;
import java.time.Month;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public final class ScheduleValidator {
    private static final List<Integer> ALL_MONTHS = List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
    private static final Pattern TIME = Pattern.compile("^([01]?\\d|2[0-3]):[0-5]\\d$");

    private final CronExpressions cronExpressions;

    public ScheduleValidator(CronExpressions cronExpressions) {
        this.cronExpressions = Objects.requireNonNull(cronExpressions, "cronExpressions must not be null");
    }

    public void validate(JobSchedule schedule) {
        List<String> violations = violations(schedule);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public List<String> violations(JobSchedule schedule) {
        List<String> violations = new ArrayList<>();
        if (schedule == null) {
            violations.add("schedule is required");
            return violations;
        }

        switch (schedule.type()) {
            case ONE_TIME -> {
                if (((OneTimeSchedule) schedule).runAt() == null) {
                    violations.add("one-time schedule requires runAt");
                }
            }
            case DELAYED -> positive(((DelayedSchedule) schedule).delayMinutes(), "delayMinutes", violations);
            case INTERVAL -> positive(((IntervalSchedule) schedule).intervalMinutes(), "intervalMinutes", violations);
            case CRON -> cron(((CronSchedule) schedule).cronExpression(), violations);
            case RECURRING -> recurring((RecurringSchedule) schedule, violations);
        }

        if (schedule.timezone() != null && !schedule.timezone().isBlank()) {
            try {
                ZoneId.of(schedule.timezone().trim());
            } catch (DateTimeException e) {
                violations.add("unknown timezone: " + schedule.timezone());
            }
        }
        if (schedule.startDate() != null && schedule.endDate() != null
            && !schedule.startDate().isBefore(schedule.endDate())) {
            violations.add("startDate must be before endDate");
        }
        return violations;
    }

    private void cron(String expression, List<String> violations) {
        if (expression == null || expression.isBlank()) {
            violations.add("cron schedule requires cronExpression");
            return;
        }
        try {
            cronExpressions.parse(expression);
        } catch (IllegalArgumentException e) {
            violations.add("invalid cron expression '" + expression + "': " + e.getMessage());
        }
    }

    private void recurring(RecurringSchedule schedule, List<String> violations) {
        if (schedule.frequency() == null) {
            violations.add("recurring schedule requires frequency");
        }
        if (schedule.time() != null && !TIME.matcher(schedule.time().trim()).matches()) {
            violations.add("time must be HH:mm: " + schedule.time());
        }
        range(schedule.daysOfWeek(), 0, 6, "daysOfWeek", violations);
        boolean daysValid = range(schedule.daysOfMonth(), 1, 31, "daysOfMonth", violations);
        boolean monthsValid = range(schedule.monthsOfYear(), 1, 12, "monthsOfYear", violations);
        if (daysValid && monthsValid && !reachable(schedule)) {
            violations.add("no month in monthsOfYear " + months(schedule) + " has any of daysOfMonth " + days(schedule));
        }
        if (schedule.frequency() == RecurrenceFrequency.CUSTOM && !schedule.hasCalendarConstraints()) {
            if (schedule.interval() == null || schedule.interval() <= 0) {
                violations.add("custom recurrence requires daysOfWeek, daysOfMonth, monthsOfYear or a positive interval");
            }
        }
    }

    private boolean range(List<Integer> values, int min, int max, String field, List<String> violations) {
        boolean valid = true;
        for (Integer value : values) {
            if (value == null || value < min || value > max) {
                violations.add(field + " values must be between " + min + " and " + max + ": " + value);
                valid = false;
            }
        }
        return valid;
    }

    // monthly and yearly default to the 1st, yearly to January
    private boolean reachable(RecurringSchedule schedule) {
        if (schedule.daysOfMonth().isEmpty() && !defaultsToFirstOfMonth(schedule)) {
            return true;
        }
        for (int month : months(schedule)) {
            int longest = Month.of(month).maxLength();
            for (int day : days(schedule)) {
                if (day <= longest) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<Integer> months(RecurringSchedule schedule) {
        if (!schedule.monthsOfYear().isEmpty()) {
            return schedule.monthsOfYear();
        }
        return schedule.frequency() == RecurrenceFrequency.YEARLY ? List.of(1) : ALL_MONTHS;
    }

    private List<Integer> days(RecurringSchedule schedule) {
        return schedule.daysOfMonth().isEmpty() ? List.of(1) : schedule.daysOfMonth();
    }

    private boolean defaultsToFirstOfMonth(RecurringSchedule schedule) {
        return schedule.frequency() == RecurrenceFrequency.MONTHLY || schedule.frequency() == RecurrenceFrequency.YEARLY;
    }

    private void positive(Integer value, String field, List<String> violations) {
        if (value == null || value <= 0) {
            violations.add(field + " must be > 0");
        }
    }
}
