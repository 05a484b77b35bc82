package io.github.fedify.amqp.queue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A one-shot signal used to stop one or more listeners.
 * Cancelling is idempotent; callbacks registered after cancellation run immediately.
 */
public final class CancellationSignal {

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    public void cancel() {
        cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /**
     * Runs {@code action} once the signal is cancelled, on the thread that calls {@link #cancel()}
     * or on the caller's thread if already cancelled.
     */
    public void onCancel(Runnable action) {
        cancelled.thenRun(action);
    }

    public CompletionStage<Void> asStage() {
        return cancelled.minimalCompletionStage();
    }
}
