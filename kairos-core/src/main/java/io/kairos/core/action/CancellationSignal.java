package io.kairos.core.action;

import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation flag shared between the executor and a running handler.
 */
public final class CancellationSignal {
    private final CompletableFuture<String> cancelled = new CompletableFuture<>();

    public void cancel(String reason) {
        cancelled.complete(reason == null ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    public String reason() {
        return cancelled.getNow(null);
    }

    /**
     * Runs {@code callback} once the signal fires, immediately if it already has.
     */
    public void onCancel(Runnable callback) {
        cancelled.thenRun(callback);
    }

    /**
     * A future completed with the reason once the signal fires. Completing it has no effect on
     * the signal.
     */
    public CompletableFuture<String> whenCancelled() {
        return cancelled.copy();
    }
}
