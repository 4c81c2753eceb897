package io.kairos.core.bulk;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.error.ErrorCode;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.InMemoryJobStore;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobAction;
import io.kairos.core.job.JobDefinition;
import io.kairos.core.job.JobService;
import io.kairos.core.job.JobValidator;
import io.kairos.core.schedule.CronExpressions;
import io.kairos.core.schedule.IntervalSchedule;
import io.kairos.core.schedule.ScheduleCalculator;
import io.kairos.core.schedule.ScheduleValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class BulkOperatorTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final InMemoryJobStore store = new InMemoryJobStore(clock);
    private final JobService jobService = new JobService(
        store,
        new JobValidator(new ScheduleValidator(new CronExpressions())),
        new ScheduleCalculator(),
        clock
    );
    private final BulkOperator operator = new BulkOperator(jobService);

    @Test
    void shouldReportOneResultPerIdInInputOrder() throws Exception {
        Job first = create("first");

        List<BulkItemResult> results = operator.apply(List.of(first.id(), "missing"), BulkOperation.DISABLE);

        assertThat(results).containsExactly(
            BulkItemResult.ok(first.id()),
            BulkItemResult.failed("missing", ErrorCode.JOB_NOT_FOUND, "Job not found: missing")
        );
        assertThat(store.get(first.id()).orElseThrow().enabled()).isFalse();
        assertThat(store.get(first.id()).orElseThrow().nextRun()).isNull();
    }

    @Test
    void shouldReEnableJobs() throws Exception {
        Job job = create("sync");
        operator.apply(List.of(job.id()), BulkOperation.DISABLE);

        List<BulkItemResult> results = operator.apply(List.of(job.id()), BulkOperation.ENABLE);

        assertThat(results).allMatch(BulkItemResult::success);
        assertThat(store.get(job.id()).orElseThrow().nextRun()).isNotNull();
    }

    @Test
    void shouldTreatDeleteOfMissingJobAsFailure() throws Exception {
        Job job = create("cleanup");

        List<BulkItemResult> results = operator.apply(Arrays.asList(job.id(), job.id(), " "), BulkOperation.DELETE);

        assertThat(results).extracting(BulkItemResult::success).containsExactly(true, false, false);
        assertThat(results).extracting(BulkItemResult::errorCode)
            .containsExactly(null, ErrorCode.JOB_NOT_FOUND, ErrorCode.VALIDATION_ERROR);
        assertThat(store.get(job.id())).isEmpty();
    }

    @Test
    void shouldReturnEmptyResultForEmptyInput() {
        assertThat(operator.apply(null, BulkOperation.ENABLE)).isEmpty();
    }

    private Job create(String name) throws Exception {
        return jobService.create(JobDefinition.of(
            "owner-1",
            name,
            IntervalSchedule.every(15),
            JobAction.of(ActionType.DATA_CLEANUP, "tasks", "archive", null)
        ));
    }
}
