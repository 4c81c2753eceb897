package io.kairos.core.action.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kairos.core.action.ActionContext;
import io.kairos.core.action.ActionException;
import io.kairos.core.action.ActionHandler;
import io.kairos.core.action.ActionResult;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.JobAction;
import io.kairos.core.model.Attributes;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls an HTTP endpoint. Parameters: {@code url} (defaults to the action target), {@code method}
 * (defaults to POST), {@code headers} and {@code data} (sent as a JSON body).
 */
public final class WebhookActionHandler implements ActionHandler {
    private static final MediaType JSON = MediaType.get("application/json");
    private static final int MAX_BODY_CHARS = 4096;

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public WebhookActionHandler(OkHttpClient client) {
        this(client, new ObjectMapper());
    }

    public WebhookActionHandler(OkHttpClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ActionType type() {
        return ActionType.WEBHOOK_CALL;
    }

    @Override
    public ActionResult execute(JobAction action, ActionContext context) throws ActionException, IOException {
        Attributes parameters = context.parameters();
        String url = parameters.string("url", action.target());
        HttpUrl httpUrl = url == null ? null : HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new ActionException("INVALID_URL", "Webhook url is missing or invalid: " + url, false);
        }
        String method = parameters.string("method", "POST").toUpperCase(Locale.ROOT);

        RequestBody body = requiresBody(method)
            ? RequestBody.create(mapper.writeValueAsString(parameters.map("data").asMap()), JSON)
            : null;
        Request.Builder requestBuilder = new Request.Builder()
            .url(httpUrl)
            .header("X-Kairos-Job-Id", context.jobId())
            .header("X-Kairos-Execution-Id", context.executionId());
        for (Map.Entry<String, Object> header : parameters.map("headers").asMap().entrySet()) {
            requestBuilder.header(header.getKey(), String.valueOf(header.getValue()));
        }
        Request request = requestBuilder.method(method, body).build();

        Call call = client.newCall(request);
        context.signal().onCancel(call::cancel);
        try (Response response = call.execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            int status = response.code();
            if (response.isSuccessful()) {
                return ActionResult.success(
                    Attributes.of(Map.of("status", status, "body", truncate(raw)))
                );
            }
            return ActionResult.failure("HTTP_" + status, "Webhook returned HTTP " + status, isRetryable(status));
        }
    }

    static boolean isRetryable(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean requiresBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    private String truncate(String raw) {
        return raw.length() <= MAX_BODY_CHARS ? raw : raw.substring(0, MAX_BODY_CHARS);
    }
}
