package io.kairos.core.config;

import java.nio.file.Path;

/**
 * @param databasePath {@code null} when the store backend is in-memory
 */
public record InitResult(
    Path configPath,
    Path databasePath,
    boolean createdConfig,
    boolean overwrittenConfig,
    boolean databaseExists
) {
}
