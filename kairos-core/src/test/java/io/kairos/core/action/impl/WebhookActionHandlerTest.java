package io.kairos.core.action.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.action.ActionContext;
import io.kairos.core.action.ActionException;
import io.kairos.core.action.ActionResult;
import io.kairos.core.action.CancellationSignal;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.JobAction;
import io.kairos.core.model.Attributes;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookActionHandlerTest {

    private MockWebServer server;
    private WebhookActionHandler handler;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        handler = new WebhookActionHandler(new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPostDataWithHeadersToTarget() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"accepted\":true}"));
        Attributes parameters = Attributes.of(Map.of(
            "headers", Map.of("Authorization", "Bearer token"),
            "data", Map.of("report", "weekly", "count", 3)
        ));
        JobAction action = JobAction.of(ActionType.WEBHOOK_CALL, server.url("/hooks/report").toString(), "call", parameters);

        ActionResult result = handler.execute(action, context(parameters));

        assertThat(result.success()).isTrue();
        assertThat(result.data().integer("status")).contains(200L);
        assertThat(result.data().string("body")).contains("{\"accepted\":true}");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/report");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token");
        assertThat(request.getHeader("X-Kairos-Job-Id")).isEqualTo("job-1");
        assertThat(request.getHeader("X-Kairos-Execution-Id")).isEqualTo("exec-1");
        assertThat(request.getBody().readUtf8()).contains("\"report\":\"weekly\"").contains("\"count\":3");
    }

    @Test
    void shouldPreferUrlParameterAndHonourMethod() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        Attributes parameters = Attributes.of(Map.of("url", server.url("/override").toString(), "method", "get"));
        JobAction action = JobAction.of(ActionType.WEBHOOK_CALL, "https://unused.example.com", "call", parameters);

        ActionResult result = handler.execute(action, context(parameters));

        RecordedRequest request = server.takeRequest();
        assertThat(result.success()).isTrue();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/override");
    }

    @Test
    void shouldMarkServerErrorsRetryable() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        JobAction action = JobAction.of(ActionType.WEBHOOK_CALL, server.url("/down").toString(), "call", null);

        ActionResult result = handler.execute(action, context(Attributes.empty()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo("HTTP_503");
        assertThat(result.retryable()).isTrue();
    }

    @Test
    void shouldNotRetryClientErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        JobAction action = JobAction.of(ActionType.WEBHOOK_CALL, server.url("/missing").toString(), "call", null);

        ActionResult result = handler.execute(action, context(Attributes.empty()));

        assertThat(result.errorCode()).isEqualTo("HTTP_404");
        assertThat(result.retryable()).isFalse();
        assertThat(WebhookActionHandler.isRetryable(429)).isTrue();
        assertThat(WebhookActionHandler.isRetryable(408)).isTrue();
    }

    @Test
    void shouldRejectInvalidUrl() {
        JobAction action = JobAction.of(ActionType.WEBHOOK_CALL, "not a url", "call", null);

        assertThatThrownBy(() -> handler.execute(action, context(Attributes.empty())))
            .isInstanceOfSatisfying(ActionException.class, error -> {
                assertThat(error.code()).isEqualTo("INVALID_URL");
                assertThat(error.retryable()).isFalse();
            });
    }

    private static ActionContext context(Attributes parameters) {
        return new ActionContext(
            "job-1",
            "exec-1",
            "owner-1",
            1,
            parameters,
            Attributes.empty(),
            Instant.parse("2026-01-01T00:00:00Z"),
            new CancellationSignal()
        );
    }
}
