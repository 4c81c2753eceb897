package io.kairos.core.action.impl;

import io.kairos.core.action.ActionContext;
import io.kairos.core.model.Attributes;

/**
 * Host-supplied code that a CUSTOM_FUNCTION job can invoke by name.
 */
@FunctionalInterface
public interface ScheduledFunction {
    Attributes apply(ActionContext context) throws Exception;
}
