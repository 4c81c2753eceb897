package io.kairos.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses standard 5-field Unix cron expressions and caches the resulting execution times.
 */
public final class CronExpressions {
    private static final CronDefinition UNIX = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private final CronParser parser = new CronParser(UNIX);
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    public ExecutionTime parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String normalized = normalize(expression);
        return cache.computeIfAbsent(normalized, this::compile);
    }

    public Optional<Instant> next(String expression, Instant after, ZoneId zone) {
        ExecutionTime executionTime = parse(expression);
        ZonedDateTime reference = after.atZone(zone);
        return executionTime.nextExecution(reference).map(ZonedDateTime::toInstant);
    }

    private ExecutionTime compile(String expression) {
        String[] fields = expression.split(" ");
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                "cron expression must have 5 fields but had " + fields.length + ": " + expression
            );
        }
        Cron cron = parser.parse(expression);
        cron.validate();
        return ExecutionTime.forCron(cron);
    }

    private String normalize(String expression) {
        return expression.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
