package io.kairos.core.action.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.action.ActionContext;
import io.kairos.core.action.ActionException;
import io.kairos.core.action.ActionResult;
import io.kairos.core.action.CancellationSignal;
import io.kairos.core.job.ActionType;
import io.kairos.core.job.JobAction;
import io.kairos.core.model.Attributes;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class FunctionActionHandlerTest {

    @Test
    void shouldInvokeFunctionNamedByTarget() throws Exception {
        FunctionActionHandler handler = new FunctionActionHandler()
            .register("double", context -> Attributes.of("value", context.parameters().integer("value").orElse(0L) * 2));

        ActionResult result = handler.execute(action("double"), context(Attributes.of("value", 21)));

        assertThat(result.success()).isTrue();
        assertThat(result.data().integer("value")).contains(42L);
        assertThat(handler.names()).containsExactly("double");
    }

    @Test
    void shouldPreferFunctionNameParameter() throws Exception {
        FunctionActionHandler handler = new FunctionActionHandler()
            .register("a", context -> Attributes.of("ran", "a"))
            .register("b", context -> Attributes.of("ran", "b"));

        ActionResult result = handler.execute(action("a"), context(Attributes.of("functionName", "b")));

        assertThat(result.data().string("ran")).contains("b");
    }

    @Test
    void shouldReportUnknownFunction() {
        FunctionActionHandler handler = new FunctionActionHandler();

        assertThatThrownBy(() -> handler.execute(action("missing"), context(Attributes.empty())))
            .isInstanceOfSatisfying(ActionException.class, error -> {
                assertThat(error.code()).isEqualTo("FUNCTION_NOT_FOUND");
                assertThat(error.retryable()).isFalse();
            });
    }

    @Test
    void shouldPropagateActionExceptionsUnchanged() {
        FunctionActionHandler handler = new FunctionActionHandler().register("quota", context -> {
            throw new ActionException("RATE_LIMITED", "slow down", true);
        });

        assertThatThrownBy(() -> handler.execute(action("quota"), context(Attributes.empty())))
            .isInstanceOfSatisfying(ActionException.class, error -> {
                assertThat(error.code()).isEqualTo("RATE_LIMITED");
                assertThat(error.retryable()).isTrue();
            });
    }

    private static JobAction action(String target) {
        return JobAction.of(ActionType.CUSTOM_FUNCTION, target, "invoke", null);
    }

    private static ActionContext context(Attributes parameters) {
        return new ActionContext("job-1", "exec-1", null, 1, parameters, Attributes.empty(), Instant.now(), new CancellationSignal());
    }
}
