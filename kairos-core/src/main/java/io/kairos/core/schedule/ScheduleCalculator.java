package io.kairos.core.schedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure next-run computation for every {@link JobSchedule} variant.
 *
 * <p>All results are strictly after the reference time, never before {@code startDate} and never
 * after {@code endDate}. An empty result means the schedule has no further runs.
 */
public final class ScheduleCalculator {
    // weekday and calendar patterns repeat every 400 Gregorian years
    private static final int GREGORIAN_CYCLE_MONTHS = 400 * 12 + 1;
    private static final LocalTime DEFAULT_TIME = LocalTime.MIDNIGHT;

    private final ZoneId defaultZone;
    private final CronExpressions cronExpressions;

    public ScheduleCalculator() {
        this(ZoneOffset.UTC, new CronExpressions());
    }

    public ScheduleCalculator(ZoneId defaultZone, CronExpressions cronExpressions) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        this.cronExpressions = Objects.requireNonNull(cronExpressions, "cronExpressions must not be null");
    }

    /**
     * @param createdAt anchor for interval schedules without a last run and for delayed schedules
     * @param referenceTime the result is strictly after this instant
     * @param lastRun last fire time, or {@code null} when the job never ran
     */
    public Optional<Instant> computeNextRun(JobSchedule schedule, Instant createdAt, Instant referenceTime, Instant lastRun) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(referenceTime, "referenceTime must not be null");

        Instant reference = referenceTime;
        if (schedule.startDate() != null && schedule.startDate().isAfter(referenceTime)) {
            reference = schedule.startDate().minusNanos(1);
        }

        Optional<Instant> candidate = switch (schedule.type()) {
            case ONE_TIME -> oneTime((OneTimeSchedule) schedule, reference, lastRun);
            case DELAYED -> delayed((DelayedSchedule) schedule, createdAt, reference, lastRun);
            case INTERVAL -> interval(
                minutes(((IntervalSchedule) schedule).intervalMinutes(), "intervalMinutes"),
                anchor(createdAt, lastRun),
                reference
            );
            case RECURRING -> recurring((RecurringSchedule) schedule, createdAt, reference, lastRun);
            case CRON -> cron((CronSchedule) schedule, reference);
        };

        Instant endDate = schedule.endDate();
        return candidate.filter(next -> endDate == null || !next.isAfter(endDate));
    }

    public List<Instant> preview(JobSchedule schedule, Instant createdAt, Instant from, int count) {
        List<Instant> runs = new ArrayList<>();
        Instant reference = from;
        Instant lastRun = null;
        for (int i = 0; i < count; i++) {
            Optional<Instant> next = computeNextRun(schedule, createdAt, reference, lastRun);
            if (next.isEmpty()) {
                break;
            }
            runs.add(next.get());
            reference = next.get();
            lastRun = next.get();
        }
        return runs;
    }

    public ZoneId zoneOf(JobSchedule schedule) {
        String timezone = schedule.timezone();
        if (timezone == null || timezone.isBlank()) {
            return defaultZone;
        }
        return ZoneId.of(timezone.trim());
    }

    private Optional<Instant> oneTime(OneTimeSchedule schedule, Instant reference, Instant lastRun) {
        Instant runAt = schedule.runAt();
        if (runAt == null) {
            throw new IllegalArgumentException("one-time schedule requires runAt");
        }
        return fireOnce(runAt, reference, lastRun);
    }

    private Optional<Instant> delayed(DelayedSchedule schedule, Instant createdAt, Instant reference, Instant lastRun) {
        long delay = minutes(schedule.delayMinutes(), "delayMinutes");
        return fireOnce(createdAt.plus(Duration.ofMinutes(delay)), reference, lastRun);
    }

    private Optional<Instant> fireOnce(Instant fireAt, Instant reference, Instant lastRun) {
        boolean alreadyRan = lastRun != null && !lastRun.isBefore(fireAt);
        if (alreadyRan || !fireAt.isAfter(reference)) {
            return Optional.empty();
        }
        return Optional.of(fireAt);
    }

    private Instant anchor(Instant createdAt, Instant lastRun) {
        return lastRun != null ? lastRun : createdAt;
    }

    private Optional<Instant> interval(long intervalMinutes, Instant anchor, Instant reference) {
        long periodMs = Duration.ofMinutes(intervalMinutes).toMillis();
        Instant first = anchor.plusMillis(periodMs);
        if (first.isAfter(reference)) {
            return Optional.of(first);
        }
        long elapsed = Duration.between(first, reference).toMillis();
        long steps = elapsed / periodMs + 1;
        return Optional.of(first.plusMillis(steps * periodMs));
    }

    private Optional<Instant> recurring(RecurringSchedule schedule, Instant createdAt, Instant reference, Instant lastRun) {
        if (schedule.frequency() == null) {
            throw new IllegalArgumentException("recurring schedule requires frequency");
        }
        if (schedule.frequency() == RecurrenceFrequency.CUSTOM && !schedule.hasCalendarConstraints()) {
            return interval(minutes(schedule.interval(), "interval"), anchor(createdAt, lastRun), reference);
        }

        ZoneId zone = zoneOf(schedule);
        LocalTime time = parseTime(schedule.time());
        List<Integer> weekdays = effective(schedule.daysOfWeek(), schedule.frequency() == RecurrenceFrequency.WEEKLY);
        List<Integer> monthDays = effective(
            schedule.daysOfMonth(),
            schedule.frequency() == RecurrenceFrequency.MONTHLY || schedule.frequency() == RecurrenceFrequency.YEARLY
        );
        List<Integer> months = effective(schedule.monthsOfYear(), schedule.frequency() == RecurrenceFrequency.YEARLY);

        LocalDate from = reference.atZone(zone).toLocalDate();
        YearMonth month = YearMonth.from(from);
        for (int i = 0; i < GREGORIAN_CYCLE_MONTHS; i++, month = month.plusMonths(1)) {
            if (!months.isEmpty() && !months.contains(month.getMonthValue())) {
                continue;
            }
            int firstDay = i == 0 ? from.getDayOfMonth() : 1;
            for (int day = firstDay; day <= month.lengthOfMonth(); day++) {
                LocalDate date = month.atDay(day);
                if (!matches(date, weekdays, monthDays)) {
                    continue;
                }
                Instant candidate = ZonedDateTime.of(date, time, zone).toInstant();
                if (candidate.isAfter(reference)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Instant> cron(CronSchedule schedule, Instant reference) {
        return cronExpressions.next(schedule.cronExpression(), reference, zoneOf(schedule));
    }

    private boolean matches(LocalDate date, List<Integer> weekdays, List<Integer> monthDays) {
        int weekday = sundayZeroIndex(date.getDayOfWeek());
        return (weekdays.isEmpty() || weekdays.contains(weekday))
            && (monthDays.isEmpty() || monthDays.contains(date.getDayOfMonth()));
    }

    private List<Integer> effective(List<Integer> values, boolean defaultToFirst) {
        if (values.isEmpty() && defaultToFirst) {
            // weekly defaults to Monday, monthly and yearly to the 1st, yearly to January
            return List.of(1);
        }
        return values;
    }

    private static int sundayZeroIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    static LocalTime parseTime(String time) {
        if (time == null || time.isBlank()) {
            return DEFAULT_TIME;
        }
        String[] parts = time.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("time must be HH:mm: " + time);
        }
        return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }

    private static long minutes(Integer value, String field) {
        if (value == null || value <= 0) {
            throw new IllegalArgumentException(field + " must be > 0");
        }
        return value;
    }
}
