package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code backend} is {@code sqlite} or {@code memory}; {@code path} is only used by sqlite.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(String backend, String path) {

    public static StoreConfig defaults() {
        return new StoreConfig("sqlite", "~/.kairos/kairos.db");
    }

    public boolean inMemory() {
        return "memory".equalsIgnoreCase(backend);
    }
}
