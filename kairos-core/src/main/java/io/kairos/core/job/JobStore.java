package io.kairos.core.job;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable job definitions plus their scheduling state. {@link #tryClaim} is the single point of
 * mutual exclusion between dispatch cycles.
 */
public interface JobStore {
    /**
     * Due-job queries ({@link JobFilter#dueAt()} set) are ordered by {@code nextRun} ascending,
     * everything else by {@code createdAt} descending.
     */
    List<Job> find(JobFilter filter) throws IOException;

    Optional<Job> get(String id) throws IOException;

    Job create(Job job) throws IOException;

    /**
     * @throws io.kairos.core.error.NotFoundException if the job does not exist
     */
    Job update(String id, JobPatch patch) throws IOException;

    boolean delete(String id) throws IOException;

    /**
     * Atomically replaces {@code nextRun} if the job exists, is enabled and its current
     * {@code nextRun} equals {@code expectedNextRun}.
     */
    boolean tryClaim(String id, Instant expectedNextRun, Instant newNextRun) throws IOException;
}
