package io.kairos.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.bulk.BulkItemResult;
import io.kairos.core.bulk.BulkOperation;
import io.kairos.core.error.ErrorCode;
import io.kairos.core.error.NotFoundException;
import io.kairos.core.error.SchedulerException;
import io.kairos.core.error.ValidationException;
import io.kairos.core.execution.JobExecution;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobDefinition;
import io.kairos.core.job.JobFilter;
import io.kairos.core.job.JobUpdate;
import io.kairos.core.model.Attributes;
import io.kairos.core.schedule.JobType;
import io.kairos.core.template.TemplateOverrides;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON API over the scheduler services.
 */
public final class SchedulerHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerHttpServer.class);
    private static final int DEFAULT_EXECUTION_LIMIT = 50;

    private final SchedulerApi api;
    private final String host;
    private final int requestedPort;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public SchedulerHttpServer(int port, String host, SchedulerApi api) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        RoutingHandler routes = Handlers.routing()
            .get("/healthz", blocking(this::handleHealth))
            .get("/jobs", blocking(this::handleListJobs))
            .post("/jobs", blocking(this::handleCreateJob))
            .post("/jobs/bulk", blocking(this::handleBulk))
            .get("/jobs/{id}", blocking(this::handleGetJob))
            .put("/jobs/{id}", blocking(this::handleUpdateJob))
            .delete("/jobs/{id}", blocking(this::handleDeleteJob))
            .post("/jobs/{id}/run", blocking(this::handleRunJob))
            .get("/jobs/{id}/executions", blocking(this::handleJobExecutions))
            .get("/jobs/{id}/stats", blocking(this::handleJobStats))
            .post("/executions/{id}/cancel", blocking(this::handleCancelExecution))
            .get("/metrics", blocking(this::handleMetrics))
            .get("/templates", blocking(this::handleListTemplates))
            .post("/templates/{id}/instantiate", blocking(this::handleInstantiate))
            .setFallbackHandler(exchange -> sendJson(exchange, 404, Map.of("error", "NOT_FOUND", "message", "No route for " + exchange.getRequestPath())))
            .setInvalidMethodHandler(exchange -> sendJson(exchange, 405, Map.of("error", "METHOD_NOT_ALLOWED", "message", "Method not allowed")));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Scheduler API listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, Map.of("status", "ok", "running", api.engine().isRunning()));
    }

    private void handleListJobs(HttpServerExchange exchange) throws IOException {
        JobFilter filter = new JobFilter(
            query(exchange, "ownerId"),
            enumParam(exchange, "type", JobType.class),
            booleanParam(exchange, "enabled"),
            enumParam(exchange, "actionType", ActionType.class),
            instantParam(exchange, "createdFrom"),
            instantParam(exchange, "createdTo"),
            null,
            intParam(exchange, "limit", 0)
        );
        List<Job> jobs = api.jobs().list(filter);
        sendJson(exchange, 200, Map.of("jobs", jobs, "count", jobs.size()));
    }

    private void handleCreateJob(HttpServerExchange exchange) throws IOException {
        JobDefinition definition = readBody(exchange, JobDefinition.class);
        sendJson(exchange, 201, api.jobs().create(definition));
    }

    private void handleGetJob(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, api.jobs().get(pathParam(exchange, "id")));
    }

    private void handleUpdateJob(HttpServerExchange exchange) throws IOException {
        JobUpdate update = readBody(exchange, JobUpdate.class);
        sendJson(exchange, 200, api.jobs().update(pathParam(exchange, "id"), update));
    }

    private void handleDeleteJob(HttpServerExchange exchange) throws IOException {
        String id = pathParam(exchange, "id");
        if (!api.jobs().delete(id)) {
            throw NotFoundException.job(id);
        }
        sendJson(exchange, 200, Map.of("deleted", true, "id", id));
    }

    private void handleRunJob(HttpServerExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        Attributes overrides = body.has("parameters")
            ? mapper.treeToValue(body.get("parameters"), Attributes.class)
            : Attributes.empty();
        JobExecution execution = api.engine().executeNow(pathParam(exchange, "id"), overrides);
        sendJson(exchange, 202, execution);
    }

    private void handleJobExecutions(HttpServerExchange exchange) throws IOException {
        String id = pathParam(exchange, "id");
        api.jobs().get(id);
        List<JobExecution> executions = api.executions().listByJob(id, intParam(exchange, "limit", DEFAULT_EXECUTION_LIMIT));
        sendJson(exchange, 200, Map.of("executions", executions, "count", executions.size()));
    }

    private void handleJobStats(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, api.statistics().jobStatistics(pathParam(exchange, "id")));
    }

    private void handleBulk(HttpServerExchange exchange) throws IOException {
        BulkRequest request = readBody(exchange, BulkRequest.class);
        if (request.operation() == null) {
            throw new ValidationException("operation is required");
        }
        List<BulkItemResult> results = api.bulk().apply(request.jobIds(), request.operation());
        long succeeded = results.stream().filter(BulkItemResult::success).count();
        sendJson(exchange, 200, Map.of(
            "results", results,
            "succeeded", succeeded,
            "failed", results.size() - succeeded
        ));
    }

    private void handleCancelExecution(HttpServerExchange exchange) throws IOException {
        String id = pathParam(exchange, "id");
        boolean cancelled = api.engine().cancel(id);
        sendJson(exchange, cancelled ? 202 : 409, Map.of("id", id, "cancelled", cancelled));
    }

    private void handleMetrics(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, api.statistics().metrics());
    }

    private void handleListTemplates(HttpServerExchange exchange) throws IOException {
        sendJson(exchange, 200, Map.of("templates", api.templates().list(query(exchange, "category"))));
    }

    private void handleInstantiate(HttpServerExchange exchange) throws IOException {
        TemplateOverrides overrides = readBody(exchange, TemplateOverrides.class);
        JobDefinition definition = api.instantiator().instantiate(pathParam(exchange, "id"), overrides);
        sendJson(exchange, 201, api.jobs().create(definition));
    }

    private HttpHandler blocking(Route route) {
        return new HttpHandler() {
            @Override
            public void handleRequest(HttpServerExchange exchange) {
                if (exchange.isInIoThread()) {
                    exchange.dispatch(this);
                    return;
                }
                exchange.startBlocking();
                try {
                    route.handle(exchange);
                } catch (Exception e) {
                    sendError(exchange, e);
                }
            }
        };
    }

    private void sendError(HttpServerExchange exchange, Exception error) {
        int status;
        Map<String, Object> payload = new LinkedHashMap<>();
        if (error instanceof ValidationException validation) {
            status = 400;
            payload.put("error", validation.code().name());
            payload.put("message", validation.getMessage());
            payload.put("details", validation.violations());
        } else if (error instanceof SchedulerException scheduler) {
            status = statusOf(scheduler.code());
            payload.put("error", scheduler.code().name());
            payload.put("message", scheduler.getMessage());
        } else if (error instanceof JsonProcessingException json) {
            status = 400;
            payload.put("error", ErrorCode.VALIDATION_ERROR.name());
            payload.put("message", "Malformed request body: " + json.getOriginalMessage());
        } else if (error instanceof IllegalArgumentException) {
            status = 400;
            payload.put("error", ErrorCode.VALIDATION_ERROR.name());
            payload.put("message", error.getMessage());
        } else if (error instanceof IOException) {
            LOG.warn("Store failure on {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(), error.getMessage());
            status = 503;
            payload.put("error", ErrorCode.STORE_UNAVAILABLE.name());
            payload.put("message", error.getMessage());
        } else {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
            status = 500;
            payload.put("error", ErrorCode.INTERNAL_ERROR.name());
            payload.put("message", error.getMessage() == null ? "internal error" : error.getMessage());
        }
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.warn("Could not send error response: {}", e.getMessage());
        }
    }

    static int statusOf(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR -> 400;
            case JOB_NOT_FOUND, TEMPLATE_NOT_FOUND, EXECUTION_NOT_FOUND -> 404;
            case STORE_UNAVAILABLE -> 503;
            case INTERNAL_ERROR -> 500;
        };
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private <T> T readBody(HttpServerExchange exchange, Class<T> type) throws IOException {
        return mapper.treeToValue(readJsonBody(exchange), type);
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private static String query(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static <E extends Enum<E>> E enumParam(HttpServerExchange exchange, String key, Class<E> type) {
        String raw = query(exchange, key);
        if (raw == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown " + key + ": " + raw);
        }
    }

    private static Boolean booleanParam(HttpServerExchange exchange, String key) {
        String raw = query(exchange, key);
        return raw == null ? null : Boolean.parseBoolean(raw);
    }

    private static Instant instantParam(HttpServerExchange exchange, String key) {
        String raw = query(exchange, key);
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ValidationException(key + " must be an ISO-8601 instant: " + raw);
        }
    }

    private static int intParam(HttpServerExchange exchange, String key, int fallback) {
        String raw = query(exchange, key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be an integer: " + raw);
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = new ArrayList<>(undertow.getListenerInfo());
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpServerExchange exchange) throws Exception;
    }

    public record BulkRequest(List<String> jobIds, BulkOperation operation) {
    }
}
