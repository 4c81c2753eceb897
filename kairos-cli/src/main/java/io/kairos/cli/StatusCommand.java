package io.kairos.cli;

import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobFilter;
import io.kairos.core.job.SqliteJobStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and stored job status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairosConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store backend: " + config.store().backend());
            System.out.println("Tick interval: " + config.scheduler().tickSeconds() + "s");
            System.out.println("Max concurrent executions: " + config.scheduler().maxConcurrentExecutions());
            System.out.println("Missed run policy: " + config.scheduler().missedRunPolicy());
            System.out.println("HTTP API: http://" + config.http().host() + ":" + config.http().port());
            if (config.store().inMemory()) {
                System.out.println("Jobs: not persisted (memory store)");
                return 0;
            }

            Path database = ConfigPaths.resolve(config.store().path());
            System.out.println("Job database: " + database);
            if (!Files.exists(database)) {
                System.out.println("Jobs: 0 (database not created yet)");
                return 0;
            }
            List<Job> jobs = new SqliteJobStore(database).find(JobFilter.all());
            long enabled = jobs.stream().filter(Job::enabled).count();
            System.out.println("Jobs: " + jobs.size() + " (" + enabled + " enabled, " + (jobs.size() - enabled) + " paused)");
            jobs.stream()
                .filter(job -> job.enabled() && job.nextRun() != null)
                .min((left, right) -> left.nextRun().compareTo(right.nextRun()))
                .ifPresent(job -> System.out.println("Next run: " + job.nextRun() + " (" + job.name() + ")"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
