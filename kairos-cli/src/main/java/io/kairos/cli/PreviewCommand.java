package io.kairos.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.schedule.CronExpressions;
import io.kairos.core.schedule.CronSchedule;
import io.kairos.core.schedule.IntervalSchedule;
import io.kairos.core.schedule.JobSchedule;
import io.kairos.core.schedule.ScheduleCalculator;
import io.kairos.core.schedule.ScheduleValidator;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "preview", description = "Print the next fire times of a schedule")
public final class PreviewCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    ScheduleSource source;

    @Option(names = {"--timezone"}, description = "Timezone for cron schedules", defaultValue = "UTC")
    String timezone;

    @Option(names = {"--count"}, description = "Number of fire times", defaultValue = "5")
    int count;

    @Option(names = {"--from"}, description = "ISO-8601 instant to start from (default: now)")
    String from;

    static final class ScheduleSource {
        @Option(names = {"--cron"}, description = "5-field cron expression")
        String cron;

        @Option(names = {"--interval"}, description = "Interval in minutes")
        Integer intervalMinutes;

        @Option(names = {"--schedule"}, description = "Schedule as JSON, e.g. {\"type\":\"RECURRING\",...}")
        String scheduleJson;
    }

    @Override
    public Integer call() {
        try {
            CronExpressions cronExpressions = new CronExpressions();
            JobSchedule schedule = schedule();
            new ScheduleValidator(cronExpressions).validate(schedule);

            Instant start = from == null || from.isBlank() ? Instant.now() : Instant.parse(from.trim());
            ScheduleCalculator calculator = new ScheduleCalculator(ZoneId.of("UTC"), cronExpressions);
            List<Instant> fireTimes = calculator.preview(schedule, start, start, Math.max(1, count));
            if (fireTimes.isEmpty()) {
                System.out.println("Schedule never fires after " + start);
                return 0;
            }
            ZoneId zone = calculator.zoneOf(schedule);
            for (Instant fireTime : fireTimes) {
                System.out.println(fireTime + "  (" + fireTime.atZone(zone).toLocalDateTime() + " " + zone + ")");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Preview failed: " + e.getMessage());
            return 1;
        }
    }

    private JobSchedule schedule() throws Exception {
        if (source.cron != null) {
            return CronSchedule.of(source.cron, timezone);
        }
        if (source.intervalMinutes != null) {
            return IntervalSchedule.every(source.intervalMinutes);
        }
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper.readValue(source.scheduleJson, JobSchedule.class);
    }
}
