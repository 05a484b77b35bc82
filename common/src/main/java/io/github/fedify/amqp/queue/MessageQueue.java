package io.github.fedify.amqp.queue;

import java.util.concurrent.CompletableFuture;

/**
 * A queue of messages that can be enqueued, optionally with a delay, and consumed
 * by listeners with at-least-once acknowledgment.
 */
public interface MessageQueue {

    /**
     * Enqueues a message for immediate delivery.
     *
     * @param message The payload. It must be encodable by the queue's codec.
     */
    default void enqueue(Object message) {
        enqueue(message, EnqueueOptions.none());
    }

    /**
     * Enqueues a message.
     * Returns once the message has been handed to the broker client; there is no broker-side confirmation.
     *
     * @param message The payload. It must be encodable by the queue's codec.
     * @param options Enqueue options, such as the delay.
     * @throws io.github.fedify.amqp.exception.EncodingException if the payload cannot be encoded.
     * @throws io.github.fedify.amqp.exception.TransportException if the broker channel is unusable.
     * @throws IllegalArgumentException if the delay in {@code options} is too long to express in milliseconds.
     */
    void enqueue(Object message, EnqueueOptions options);

    default CompletableFuture<Void> listen(MessageHandler handler) {
        return listen(handler, ListenOptions.none());
    }

    /**
     * Starts consuming messages, one at a time, until the cancellation signal in {@code options} fires.
     *
     * @param handler Invoked once per message. The message is acknowledged when the returned stage completes,
     *                whether it completes normally or exceptionally.
     * @param options Listen options, such as the cancellation signal.
     * @return A future that completes once the listener has shut down cleanly, or completes exceptionally if the
     * subscription could not be set up or was lost.
     */
    CompletableFuture<Void> listen(MessageHandler handler, ListenOptions options);
}
