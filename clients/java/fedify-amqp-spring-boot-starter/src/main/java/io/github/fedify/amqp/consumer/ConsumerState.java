package io.github.fedify.amqp.consumer;

/**
 * Lifecycle of one listen session.
 * <pre>
 * IDLE → SUBSCRIBED → (DELIVERING → ACKING → SUBSCRIBED)* → CANCELLING → CLOSED
 * </pre>
 * {@code CLOSED} is reached through cancellation, or when the broker ends the subscription.
 */
public enum ConsumerState {
    IDLE,
    SUBSCRIBED,
    DELIVERING,
    ACKING,
    CANCELLING,
    CLOSED
}
