package io.kairos.cli;

import io.kairos.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
