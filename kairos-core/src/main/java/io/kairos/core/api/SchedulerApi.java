package io.kairos.core.api;

import io.kairos.core.bulk.BulkOperator;
import io.kairos.core.engine.SchedulerEngine;
import io.kairos.core.execution.ExecutionStore;
import io.kairos.core.job.JobService;
import io.kairos.core.stats.StatisticsService;
import io.kairos.core.template.TemplateCatalog;
import io.kairos.core.template.TemplateInstantiator;
import java.util.Objects;

/**
 * The services the HTTP API delegates to.
 */
public record SchedulerApi(
    JobService jobs,
    SchedulerEngine engine,
    ExecutionStore executions,
    StatisticsService statistics,
    BulkOperator bulk,
    TemplateCatalog templates,
    TemplateInstantiator instantiator
) {
    public SchedulerApi {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(executions, "executions must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        Objects.requireNonNull(bulk, "bulk must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
        Objects.requireNonNull(instantiator, "instantiator must not be null");
    }
}
