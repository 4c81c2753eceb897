package io.kairos.core.engine;

import io.kairos.core.execution.JobExecution;
import java.io.IOException;

@FunctionalInterface
public interface OccurrenceSink {
    JobExecution submit(Occurrence occurrence) throws IOException;
}
