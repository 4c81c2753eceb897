package io.kairos.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kairos.core.action.ActionHandlerRegistry;
import io.kairos.core.action.impl.FunctionActionHandler;
import io.kairos.core.bulk.BulkOperator;
import io.kairos.core.engine.MissedRunPolicy;
import io.kairos.core.engine.SchedulerEngine;
import io.kairos.core.engine.SchedulerSettings;
import io.kairos.core.execution.InMemoryExecutionStore;
import io.kairos.core.job.InMemoryJobStore;
import io.kairos.core.job.JobService;
import io.kairos.core.job.JobValidator;
import io.kairos.core.schedule.CronExpressions;
import io.kairos.core.schedule.ScheduleCalculator;
import io.kairos.core.schedule.ScheduleValidator;
import io.kairos.core.stats.StatisticsService;
import io.kairos.core.template.InMemoryTemplateCatalog;
import io.kairos.core.template.TemplateInstantiator;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchedulerHttpServerTest {
    private static final String CRON_JOB = """
        {
          "ownerId": "owner-1",
          "name": "weekday digest",
          "schedule": {"type": "CRON", "cronExpression": "0 9 * * MON-FRI", "timezone": "UTC"},
          "action": {"type": "CUSTOM_FUNCTION", "target": "echo", "method": "invoke", "parameters": {"greeting": "hi"}}
        }
        """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private SchedulerEngine engine;
    private SchedulerHttpServer server;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        InMemoryJobStore jobStore = new InMemoryJobStore(clock);
        InMemoryExecutionStore executionStore = new InMemoryExecutionStore();
        CronExpressions cronExpressions = new CronExpressions();
        ScheduleCalculator calculator = new ScheduleCalculator(ZoneId.of("UTC"), cronExpressions);
        JobService jobService = new JobService(jobStore, new JobValidator(new ScheduleValidator(cronExpressions)), calculator, clock);
        ActionHandlerRegistry handlers = new ActionHandlerRegistry();
        handlers.register(new FunctionActionHandler().register("echo", context -> context.parameters()));
        SchedulerSettings settings = new SchedulerSettings(
            Duration.ofHours(1), 2, Duration.ofSeconds(5), Duration.ofMillis(200), MissedRunPolicy.COALESCE, ZoneId.of("UTC")
        );
        engine = new SchedulerEngine(jobStore, executionStore, handlers, calculator, clock, settings);
        InMemoryTemplateCatalog templates = InMemoryTemplateCatalog.defaults();
        SchedulerApi api = new SchedulerApi(
            jobService,
            engine,
            executionStore,
            new StatisticsService(jobStore, executionStore, clock, ZoneId.of("UTC")),
            new BulkOperator(jobService),
            templates,
            new TemplateInstantiator(templates)
        );
        server = new SchedulerHttpServer(0, "127.0.0.1", api);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        engine.close();
    }

    @Test
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = send("GET", "/healthz", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).path("status").asText()).isEqualTo("ok");
        assertThat(json(response).path("running").asBoolean()).isFalse();
    }

    @Test
    void shouldManageJobLifecycle() throws Exception {
        HttpResponse<String> created = send("POST", "/jobs", CRON_JOB);
        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode job = json(created);
        String id = job.path("id").asText();
        assertThat(job.path("type").asText()).isEqualTo("CRON");
        assertThat(job.path("nextRun").isTextual()).isTrue();

        assertThat(send("GET", "/jobs/" + id, null).statusCode()).isEqualTo(200);
        JsonNode listed = json(send("GET", "/jobs?type=cron&ownerId=owner-1", null));
        assertThat(listed.path("count").asInt()).isEqualTo(1);

        JsonNode paused = json(send("PUT", "/jobs/" + id, "{\"enabled\": false}"));
        assertThat(paused.path("enabled").asBoolean()).isFalse();
        assertThat(paused.path("nextRun").isNull()).isTrue();

        HttpResponse<String> deleted = send("DELETE", "/jobs/" + id, null);
        assertThat(deleted.statusCode()).isEqualTo(200);
        assertThat(json(deleted).path("deleted").asBoolean()).isTrue();

        HttpResponse<String> missing = send("GET", "/jobs/" + id, null);
        assertThat(missing.statusCode()).isEqualTo(404);
        assertThat(json(missing).path("error").asText()).isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void shouldRejectInvalidJobWithDetails() throws Exception {
        String invalid = """
            {
              "name": "",
              "schedule": {"type": "INTERVAL", "intervalMinutes": 0},
              "action": {"type": "WEBHOOK_CALL", "target": "https://example.com", "method": "POST"}
            }
            """;

        HttpResponse<String> response = send("POST", "/jobs", invalid);

        assertThat(response.statusCode()).isEqualTo(400);
        JsonNode body = json(response);
        assertThat(body.path("error").asText()).isEqualTo("VALIDATION_ERROR");
        assertThat(body.path("details")).hasSize(2);
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        HttpResponse<String> response = send("POST", "/jobs", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(json(response).path("error").asText()).isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void shouldRunJobNowAndListExecutions() throws Exception {
        String id = json(send("POST", "/jobs", CRON_JOB)).path("id").asText();

        HttpResponse<String> accepted = send("POST", "/jobs/" + id + "/run", "{\"parameters\": {\"greeting\": \"hello\"}}");
        assertThat(accepted.statusCode()).isEqualTo(202);
        assertThat(json(accepted).path("trigger").asText()).isEqualTo("MANUAL");

        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!json(send("GET", "/jobs/" + id + "/executions", null))
            .path("executions").path(0).path("status").asText().equals("COMPLETED")) {
            assertThat(System.nanoTime()).as("execution completes within 10s").isLessThan(deadline);
            Thread.sleep(20);
        }
        JsonNode execution = json(send("GET", "/jobs/" + id + "/executions?limit=5", null)).path("executions").path(0);
        assertThat(execution.path("result").path("greeting").asText()).isEqualTo("hello");

        JsonNode stats = json(send("GET", "/jobs/" + id + "/stats", null));
        assertThat(stats.path("totalExecutions").asInt()).isEqualTo(1);
        assertThat(stats.path("successRate").asDouble()).isEqualTo(100.0);
    }

    @Test
    void shouldApplyBulkOperation() throws Exception {
        String id = json(send("POST", "/jobs", CRON_JOB)).path("id").asText();

        HttpResponse<String> response = send("POST", "/jobs/bulk", "{\"jobIds\": [\"" + id + "\", \"missing\"], \"operation\": \"DISABLE\"}");

        JsonNode body = json(response);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(body.path("succeeded").asInt()).isEqualTo(1);
        assertThat(body.path("failed").asInt()).isEqualTo(1);
        assertThat(body.path("results").path(1).path("errorCode").asText()).isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void shouldInstantiateTemplateWithOverrides() throws Exception {
        JsonNode templates = json(send("GET", "/templates?category=integrations", null));
        assertThat(templates.path("templates")).hasSize(1);

        HttpResponse<String> created = send(
            "POST",
            "/templates/integration-sync/instantiate",
            "{\"ownerId\": \"owner-1\", \"schedule\": {\"intervalMinutes\": 5}}"
        );

        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode job = json(created);
        assertThat(job.path("schedule").path("intervalMinutes").asInt()).isEqualTo(5);
        assertThat(job.path("metadata").path("templateId").asText()).isEqualTo("integration-sync");
        assertThat(send("POST", "/templates/unknown/instantiate", "{}").statusCode()).isEqualTo(404);
    }

    @Test
    void shouldServeMetricsAndRejectUnknownCancel() throws Exception {
        send("POST", "/jobs", CRON_JOB);

        JsonNode metrics = json(send("GET", "/metrics", null));
        HttpResponse<String> cancel = send("POST", "/executions/unknown/cancel", null);

        assertThat(metrics.path("totalJobs").asInt()).isEqualTo(1);
        assertThat(metrics.path("upcomingJobs")).hasSize(1);
        assertThat(cancel.statusCode()).isEqualTo(404);
        assertThat(json(cancel).path("error").asText()).isEqualTo("EXECUTION_NOT_FOUND");
        assertThat(send("GET", "/nowhere", null).statusCode()).isEqualTo(404);
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .header("Content-Type", "application/json")
            .method(method, publisher)
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }
}
