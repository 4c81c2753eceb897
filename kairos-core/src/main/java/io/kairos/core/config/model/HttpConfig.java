package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpConfig(String host, int port, int webhookTimeoutSeconds) {

    public static HttpConfig defaults() {
        return new HttpConfig("127.0.0.1", 8790, 30);
    }
}
