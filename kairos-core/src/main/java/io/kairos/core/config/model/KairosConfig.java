package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KairosConfig(
    SchedulerConfig scheduler,
    StoreConfig store,
    HttpConfig http,
    HealthConfig health
) {

    public static KairosConfig defaults() {
        return new KairosConfig(
            SchedulerConfig.defaults(),
            StoreConfig.defaults(),
            HttpConfig.defaults(),
            HealthConfig.defaults()
        );
    }
}
