package io.kairos.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kairos.core.config.model.HealthConfig;
import io.kairos.core.config.model.HttpConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.SchedulerConfig;
import io.kairos.core.config.model.StoreConfig;
import io.kairos.core.model.Attributes;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@code ~/.kairos/config.json}. Values in the file are layered over
 * {@link KairosConfig#defaults()}, so a partial file only needs the keys it changes.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);
    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ConfigService() {
        this(new ObjectMapper());
    }

    public ConfigService(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @throws IllegalArgumentException if the merged values are out of range
     */
    public KairosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            LOG.debug("No config at {}; using defaults", configPath);
            return KairosConfig.defaults();
        }

        Attributes defaults = Attributes.of(mapper.convertValue(KairosConfig.defaults(), TREE));
        Attributes fromFile = Attributes.of(mapper.readValue(configPath.toFile(), TREE));
        KairosConfig config = mapper.convertValue(defaults.deepMerge(fromFile).asMap(), KairosConfig.class);

        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid config " + configPath + ": " + String.join("; ", problems));
        }
        return config;
    }

    /**
     * Writes through a sibling temp file so a crash never leaves a truncated config behind.
     */
    public void save(Path configPath, KairosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path target = configPath.toAbsolutePath();
        Files.createDirectories(target.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Writes the config file (defaults when absent or when {@code overwrite} is set, otherwise the
     * existing values with any newly introduced keys filled in) and prepares the database directory.
     */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        boolean created = !Files.exists(configPath);
        KairosConfig config = created || overwrite ? KairosConfig.defaults() : load(configPath);
        save(configPath, config);

        Path database = null;
        boolean databaseExists = false;
        if (!config.store().inMemory()) {
            database = ConfigPaths.resolve(config.store().path());
            Path parent = database.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            databaseExists = Files.exists(database);
        }
        LOG.info("Initialized config {} (created={}, overwritten={})", configPath, created, !created && overwrite);
        return new InitResult(configPath, database, created, !created && overwrite, databaseExists);
    }

    public List<String> validate(KairosConfig config) {
        List<String> problems = new ArrayList<>();
        SchedulerConfig scheduler = config.scheduler();
        if (scheduler.tickSeconds() < 1) {
            problems.add("scheduler.tickSeconds must be >= 1");
        }
        if (scheduler.maxConcurrentExecutions() < 1) {
            problems.add("scheduler.maxConcurrentExecutions must be >= 1");
        }
        if (scheduler.defaultTimeoutSeconds() < 1) {
            problems.add("scheduler.defaultTimeoutSeconds must be >= 1");
        }
        if (scheduler.cancelGraceSeconds() < 0) {
            problems.add("scheduler.cancelGraceSeconds must be >= 0");
        }
        if (scheduler.missedRunPolicy() == null) {
            problems.add("scheduler.missedRunPolicy is required");
        }
        if (scheduler.zone() != null && !scheduler.zone().isBlank()) {
            try {
                ZoneId.of(scheduler.zone().trim());
            } catch (DateTimeException e) {
                problems.add("scheduler.zone '" + scheduler.zone() + "' is not a known time zone");
            }
        }

        StoreConfig store = config.store();
        if (!store.inMemory() && !"sqlite".equalsIgnoreCase(store.backend())) {
            problems.add("store.backend must be sqlite or memory");
        }

        HttpConfig http = config.http();
        if (http.port() < 0 || http.port() > 65535) {
            problems.add("http.port must be between 0 and 65535");
        }
        if (http.webhookTimeoutSeconds() < 1) {
            problems.add("http.webhookTimeoutSeconds must be >= 1");
        }

        HealthConfig health = config.health();
        if (health.checkIntervalMinutes() < 1) {
            problems.add("health.checkIntervalMinutes must be >= 1");
        }
        if (health.stuckAfterMinutes() < 1) {
            problems.add("health.stuckAfterMinutes must be >= 1");
        }
        if (health.maxFailures() < 1) {
            problems.add("health.maxFailures must be >= 1");
        }
        if (health.failureWindowHours() < 1) {
            problems.add("health.failureWindowHours must be >= 1");
        }
        return problems;
    }
}
