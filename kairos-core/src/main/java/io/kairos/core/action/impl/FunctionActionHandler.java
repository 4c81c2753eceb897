package io.kairos.core.action.impl;

import io.kairos.core.action.ActionContext;
import io.kairos.core.action.ActionException;
import io.kairos.core.action.ActionHandler;
import io.kairos.core.action.ActionResult;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.JobAction;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches CUSTOM_FUNCTION actions to functions registered by the host application. The
 * function name comes from the {@code functionName} parameter, falling back to the action target.
 */
public final class FunctionActionHandler implements ActionHandler {
    private final Map<String, ScheduledFunction> functions = new ConcurrentHashMap<>();

    public FunctionActionHandler register(String name, ScheduledFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        functions.put(name, Objects.requireNonNull(function, "function must not be null"));
        return this;
    }

    public Set<String> names() {
        return Set.copyOf(functions.keySet());
    }

    @Override
    public ActionType type() {
        return ActionType.CUSTOM_FUNCTION;
    }

    @Override
    public ActionResult execute(JobAction action, ActionContext context) throws ActionException, IOException {
        String name = context.parameters().string("functionName", action.target());
        ScheduledFunction function = name == null ? null : functions.get(name);
        if (function == null) {
            throw new ActionException("FUNCTION_NOT_FOUND", "No function registered as '" + name + "'", false);
        }
        try {
            return ActionResult.success(function.apply(context));
        } catch (ActionException | IOException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("INTERRUPTED", "Function '" + name + "' was interrupted", true, e);
        } catch (Exception e) {
            throw new ActionException("FUNCTION_FAILED", "Function '" + name + "' failed: " + e.getMessage(), false, e);
        }
    }
}
