package io.kairos.app;

import io.kairos.cli.CliContext;
import io.kairos.cli.InitCommand;
import io.kairos.cli.KairosCliCommand;
import io.kairos.cli.PreviewCommand;
import io.kairos.cli.ServeCommand;
import io.kairos.cli.StatusCommand;
import io.kairos.cli.TemplatesCommand;
import io.kairos.core.action.ActionHandlerRegistry;
import io.kairos.core.action.impl.FunctionActionHandler;
import io.kairos.core.action.impl.WebhookActionHandler;
import io.kairos.core.api.SchedulerApi;
import io.kairos.core.api.SchedulerHttpServer;
import io.kairos.core.bulk.BulkOperator;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.engine.SchedulerEngine;
import io.kairos.core.engine.SchedulerSettings;
import io.kairos.core.execution.ExecutionStore;
import io.kairos.core.execution.InMemoryExecutionStore;
import io.kairos.core.execution.SqliteExecutionStore;
import io.kairos.core.job.InMemoryJobStore;
import io.kairos.core.job.JobService;
import io.kairos.core.job.JobStore;
import io.kairos.core.job.JobValidator;
import io.kairos.core.job.SqliteJobStore;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.CronExpressions;
import io.kairos.core.schedule.ScheduleCalculator;
import io.kairos.core.schedule.ScheduleValidator;
import io.kairos.core.stats.HealthMonitor;
import io.kairos.core.stats.StatisticsService;
import io.kairos.core.template.InMemoryTemplateCatalog;
import io.kairos.core.template.TemplateInstantiator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KairosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KairosApplication.class);

    private KairosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        CliContext context = new CliContext(
            configService,
            configPath,
            (host, port) -> runServer(configService, configPath, host, port)
        );

        CommandLine commandLine = new CommandLine(new KairosCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("templates", new TemplatesCommand());
        commandLine.addSubcommand("preview", new PreviewCommand());

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(ConfigService configService, Path configPath, String hostOverride, Integer portOverride)
        throws Exception {
        KairosConfig config = loadConfig(configService, configPath);
        SchedulerSettings settings = config.scheduler().toSettings();
        Clock clock = Clock.systemUTC();

        JobStore jobStore = buildJobStore(config, clock);
        ExecutionStore executionStore = buildExecutionStore(config);
        CronExpressions cronExpressions = new CronExpressions();
        ScheduleCalculator calculator = new ScheduleCalculator(settings.zone(), cronExpressions);
        JobService jobService = new JobService(
            jobStore,
            new JobValidator(new ScheduleValidator(cronExpressions)),
            calculator,
            clock
        );

        ActionHandlerRegistry handlers = new ActionHandlerRegistry();
        handlers.register(new WebhookActionHandler(buildHttpClient(config)));
        handlers.register(new FunctionActionHandler()
            .register("echo", actionContext -> actionContext.parameters())
            .register("log", actionContext -> {
                LOG.info("Job {} (execution {}) fired with {}", actionContext.jobId(), actionContext.executionId(), actionContext.parameters());
                return Attributes.empty();
            }));

        InMemoryTemplateCatalog templates = InMemoryTemplateCatalog.defaults();
        String host = hostOverride != null ? hostOverride : config.http().host();
        int port = portOverride != null ? portOverride : config.http().port();

        CountDownLatch shutdown = new CountDownLatch(1);
        try (SchedulerEngine engine = new SchedulerEngine(jobStore, executionStore, handlers, calculator, clock, settings);
             SchedulerHttpServer server = new SchedulerHttpServer(port, host, new SchedulerApi(
                 jobService,
                 engine,
                 executionStore,
                 new StatisticsService(jobStore, executionStore, clock, settings.zone()),
                 new BulkOperator(jobService),
                 templates,
                 new TemplateInstantiator(templates)
             ));
             HealthMonitor health = new HealthMonitor(
                 jobStore,
                 executionStore,
                 clock,
                 config.health().toSettings(),
                 engine::isTracking
             )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            engine.start();
            server.start();
            if (config.health().enabled()) {
                health.start();
            }
            System.out.println("Kairos scheduler started on http://" + host + ":" + server.port());
            System.out.println("Store: " + config.store().backend() + ", tick every " + settings.tickInterval().toSeconds() + "s");
            shutdown.await();
        }
        return 0;
    }

    private static KairosConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException e) {
            LOG.warn("Could not read {} ({}); using defaults", configPath, e.getMessage());
            return KairosConfig.defaults();
        }
    }

    private static JobStore buildJobStore(KairosConfig config, Clock clock) {
        if (config.store().inMemory()) {
            return new InMemoryJobStore(clock);
        }
        Path database = ConfigPaths.resolve(config.store().path());
        try {
            return new SqliteJobStore(database, clock);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize SQLite job store at " + database, e);
        }
    }

    private static ExecutionStore buildExecutionStore(KairosConfig config) {
        if (config.store().inMemory()) {
            return new InMemoryExecutionStore();
        }
        Path database = ConfigPaths.resolve(config.store().path());
        try {
            return new SqliteExecutionStore(database);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize SQLite execution store at " + database, e);
        }
    }

    private static OkHttpClient buildHttpClient(KairosConfig config) {
        Duration timeout = Duration.ofSeconds(Math.max(1, config.http().webhookTimeoutSeconds()));
        return new OkHttpClient.Builder()
            .callTimeout(timeout)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }
}
