package io.github.fedify.amqp.queue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Processes one decoded message.
 * <p>
 * The returned stage tells the listener when processing is over. The message is acknowledged in both outcomes:
 * a failed stage (or an exception thrown from {@link #handle(Object)}) is logged, not redelivered.
 * Retrying failed business logic is up to the handler.
 */
@FunctionalInterface
public interface MessageHandler {

    CompletionStage<Void> handle(Object message);

    /**
     * Adapts a synchronous handler. Its completion is reported as an already completed stage.
     */
    static MessageHandler of(Consumer<Object> handler) {
        return message -> {
            handler.accept(message);
            return CompletableFuture.completedFuture(null);
        };
    }
}
