package io.kairos.core.execution;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-mostly execution log. Records are never deleted.
 */
public interface ExecutionStore {
    String append(JobExecution execution) throws IOException;

    /**
     * @throws io.kairos.core.error.NotFoundException if the execution does not exist
     * @throws IllegalStateException if the transition is not allowed from the stored status
     */
    JobExecution update(String id, ExecutionPatch patch) throws IOException;

    Optional<JobExecution> get(String id) throws IOException;

    /**
     * Most recent first.
     */
    List<JobExecution> listByJob(String jobId, int limit) throws IOException;

    List<JobExecution> listStartedSince(Instant since) throws IOException;

    /**
     * PENDING, RUNNING and RETRYING executions, oldest first.
     */
    List<JobExecution> listUnfinished() throws IOException;
}
