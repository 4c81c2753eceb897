package io.kairos.core.bulk;

import io.kairos.core.error.ErrorCode;
import io.kairos.core.error.NotFoundException;
import io.kairos.core.error.SchedulerException;
import io.kairos.core.job.JobService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies one operation to many jobs. Every input id gets exactly one result, in input order;
 * a failing item never stops the rest of the batch.
 */
public final class BulkOperator {
    private static final Logger LOG = LoggerFactory.getLogger(BulkOperator.class);

    private final JobService jobService;

    public BulkOperator(JobService jobService) {
        this.jobService = Objects.requireNonNull(jobService, "jobService must not be null");
    }

    public List<BulkItemResult> apply(List<String> jobIds, BulkOperation operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        List<String> ids = jobIds == null ? List.of() : jobIds;
        List<BulkItemResult> results = new ArrayList<>(ids.size());
        for (String jobId : ids) {
            results.add(applyOne(jobId, operation));
        }
        long failed = results.stream().filter(result -> !result.success()).count();
        LOG.info("Bulk {} over {} jobs: {} succeeded, {} failed", operation, ids.size(), ids.size() - failed, failed);
        return results;
    }

    private BulkItemResult applyOne(String jobId, BulkOperation operation) {
        if (jobId == null || jobId.isBlank()) {
            return BulkItemResult.failed(jobId, ErrorCode.VALIDATION_ERROR, "job id must not be blank");
        }
        try {
            switch (operation) {
                case ENABLE -> jobService.setEnabled(jobId, true);
                case DISABLE -> jobService.setEnabled(jobId, false);
                case DELETE -> {
                    if (!jobService.delete(jobId)) {
                        throw NotFoundException.job(jobId);
                    }
                }
            }
            return BulkItemResult.ok(jobId);
        } catch (SchedulerException e) {
            return BulkItemResult.failed(jobId, e.code(), e.getMessage());
        } catch (IOException e) {
            LOG.warn("Bulk {} of job {} failed on the store: {}", operation, jobId, e.getMessage());
            return BulkItemResult.failed(jobId, ErrorCode.STORE_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Bulk {} of job {} failed", operation, jobId, e);
            return BulkItemResult.failed(jobId, ErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }
}
