package io.kairos.core.action;

import io.kairos.core.job.ActionType;
import io.kairos.core.job.JobAction;
import java.io.IOException;

/**
 * Performs the business effect of a job action. Implementations should poll or subscribe to
 * {@link ActionContext#signal()} and stop early once it is cancelled.
 */
public interface ActionHandler {
    ActionType type();

    /**
     * @throws ActionException for failures with an explicit code and retry classification
     * @throws IOException for transport failures; these are treated as retryable
     */
    ActionResult execute(JobAction action, ActionContext context) throws ActionException, IOException;
}
