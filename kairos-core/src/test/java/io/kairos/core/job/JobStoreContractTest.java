package io.kairos.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.error.NotFoundException;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.CronSchedule;
import io.kairos.core.schedule.IntervalSchedule;
import io.kairos.core.schedule.JobType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobStoreContractTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void inMemoryStoreShouldHonourContract() throws Exception {
        verifyContract(new InMemoryJobStore(CLOCK));
    }

    @Test
    void sqliteStoreShouldHonourContract() throws Exception {
        verifyContract(new SqliteJobStore(tempDir.resolve("data/kairos.db"), CLOCK));
    }

    @Test
    void sqliteStoreShouldSurviveReopen() throws Exception {
        Path db = tempDir.resolve("kairos.db");
        Job job = job("persisted", "owner-1", NOW, NOW.plusSeconds(60), true);
        new SqliteJobStore(db, CLOCK).create(job);

        Job reloaded = new SqliteJobStore(db, CLOCK).get("persisted").orElseThrow();

        assertThat(reloaded).isEqualTo(job);
        assertThat(reloaded.schedule()).isEqualTo(IntervalSchedule.every(1));
        assertThat(reloaded.action().parameters().string("channel")).contains("ops");
    }

    @Test
    void sqliteLastRunUpdateShouldNotRevertClaimFromAnotherInstance() throws Exception {
        Path db = tempDir.resolve("shared.db");
        SqliteJobStore claimer = new SqliteJobStore(db, CLOCK);
        SqliteJobStore recorder = new SqliteJobStore(db, CLOCK);
        claimer.create(job("shared", "owner-1", NOW, NOW, true));

        AtomicBoolean claiming = new AtomicBoolean(true);
        AtomicInteger lastRunWrites = new AtomicInteger();
        Thread lastRunWriter = new Thread(() -> {
            while (claiming.get()) {
                try {
                    recorder.update("shared", JobPatch.lastRun(NOW));
                    lastRunWrites.incrementAndGet();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        });
        lastRunWriter.start();
        long deadline = System.nanoTime() + 5_000_000_000L;
        while (lastRunWrites.get() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        int failedClaims = 0;
        Instant expected = NOW;
        try {
            for (int i = 1; i <= 100; i++) {
                Instant next = NOW.plusSeconds(60L * i);
                if (claimer.tryClaim("shared", expected, next)) {
                    expected = next;
                } else {
                    failedClaims++;
                    expected = claimer.get("shared").orElseThrow().nextRun();
                }
            }
        } finally {
            claiming.set(false);
            lastRunWriter.join(5000);
        }

        assertThat(failedClaims).isZero();
        assertThat(lastRunWrites.get()).isPositive();
        Job stored = recorder.get("shared").orElseThrow();
        assertThat(stored.nextRun()).isEqualTo(NOW.plusSeconds(6000));
        assertThat(stored.lastRun()).isEqualTo(NOW);
    }

    private void verifyContract(JobStore store) throws Exception {
        Instant due = NOW.minusSeconds(30);
        store.create(job("early", "alice", NOW.minusSeconds(300), due, true));
        store.create(job("late", "alice", NOW.minusSeconds(200), NOW.minusSeconds(10), true));
        store.create(job("future", "bob", NOW.minusSeconds(100), NOW.plusSeconds(600), true));
        store.create(job("paused", "bob", NOW.minusSeconds(50), NOW.minusSeconds(60), false));

        List<Job> dueJobs = store.find(JobFilter.due(NOW));
        assertThat(dueJobs).extracting(Job::id).containsExactly("early", "late");

        List<Job> newestFirst = store.find(JobFilter.all());
        assertThat(newestFirst).extracting(Job::id).containsExactly("paused", "future", "late", "early");
        assertThat(store.find(JobFilter.all().withLimit(2))).hasSize(2);
        assertThat(store.find(new JobFilter("bob", JobType.INTERVAL, null, null, null, null, null, 0)))
            .extracting(Job::id)
            .containsExactly("paused", "future");

        // only the caller holding the current nextRun wins
        Instant advanced = NOW.plusSeconds(60);
        assertThat(store.tryClaim("early", due, advanced)).isTrue();
        assertThat(store.tryClaim("early", due, advanced)).isFalse();
        assertThat(store.get("early").orElseThrow().nextRun()).isEqualTo(advanced);
        assertThat(store.tryClaim("paused", NOW.minusSeconds(60), advanced)).isFalse();
        assertThat(store.tryClaim("missing", due, advanced)).isFalse();

        Job updated = store.update("late", JobPatch.builder().enabled(false).nextRun(null).lastRun(NOW).build());
        assertThat(updated.enabled()).isFalse();
        assertThat(updated.nextRun()).isNull();
        assertThat(updated.lastRun()).isEqualTo(NOW);
        assertThat(store.get("late")).contains(updated);

        assertThatThrownBy(() -> store.update("missing", JobPatch.lastRun(NOW))).isInstanceOf(NotFoundException.class);
        assertThat(store.delete("future")).isTrue();
        assertThat(store.get("future")).isEmpty();
    }

    private static Job job(String id, String owner, Instant createdAt, Instant nextRun, boolean enabled) {
        JobAction action = JobAction.of(ActionType.WEBHOOK_CALL, "https://example.com", "POST", Attributes.of("channel", "ops"));
        return new Job(
            id,
            owner,
            id,
            null,
            IntervalSchedule.every(1),
            action,
            enabled,
            Attributes.empty(),
            null,
            nextRun,
            createdAt,
            createdAt
        );
    }

    @Test
    void shouldMatchCronJobsOnlyWhenTypeFilterIsCron() {
        Job cron = new Job(
            "c", "o", "c", null, CronSchedule.of("0 * * * *", null),
            JobAction.of(ActionType.CUSTOM_FUNCTION, "noop", "invoke", null), true, null, null, null, NOW, null
        );

        assertThat(new JobFilter(null, JobType.CRON, null, null, null, null, null, 0).matches(cron)).isTrue();
        assertThat(new JobFilter(null, JobType.INTERVAL, null, null, null, null, null, 0).matches(cron)).isFalse();
        assertThat(new JobFilter(null, null, null, ActionType.CUSTOM_FUNCTION, null, null, null, 0).matches(cron)).isTrue();
    }
}
