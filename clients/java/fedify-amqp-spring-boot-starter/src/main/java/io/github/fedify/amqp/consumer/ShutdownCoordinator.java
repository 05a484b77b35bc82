package io.github.fedify.amqp.consumer;

import com.rabbitmq.client.Channel;
import io.github.fedify.amqp.connection.AmqpErrors;
import io.github.fedify.amqp.connection.ChannelManager;
import io.github.fedify.amqp.exception.MessageQueueException;
import io.github.fedify.amqp.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ends a listen session in a fixed order: cancel the consumer, wait for the broker's cancel-ok, wait for the
 * in-flight delivery to be acked, close the channel. Nothing here blocks the thread that requests the shutdown,
 * and the in-flight handler is never interrupted.
 */
@Slf4j
public class ShutdownCoordinator {

    private final Channel channel;
    private final DeliveryConsumer consumer;
    private final String consumerTag;
    private final String queue;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    public ShutdownCoordinator(Channel channel, DeliveryConsumer consumer, String consumerTag, String queue) {
        this.channel = channel;
        this.consumer = consumer;
        this.consumerTag = consumerTag;
        this.queue = queue;
    }

    /**
     * Starts the shutdown sequence, once. Later calls return the same future.
     *
     * @return A future that completes when the channel has been closed.
     */
    public CompletableFuture<Void> shutdown() {
        if (!started.compareAndSet(false, true)) {
            return completion;
        }
        log.info("Stopping consumer [{}] on queue [{}]", consumerTag, queue);
        consumer.markCancelling();

        CompletableFuture.runAsync(this::cancelConsumer)
                .thenCompose(ignored -> consumer.cancelled())
                .thenCompose(ignored -> consumer.inFlight())
                .thenRunAsync(this::closeChannel)
                .whenComplete((ignored, error) -> {
                    consumer.markClosed();
                    if (error == null) {
                        log.info("Consumer [{}] on queue [{}] stopped.", consumerTag, queue);
                        completion.complete(null);
                    } else {
                        Throwable cause = unwrap(error);
                        log.error("Consumer [{}] on queue [{}] did not stop cleanly.", consumerTag, queue, cause);
                        ChannelManager.closeQuietly(channel);
                        completion.completeExceptionally(cause);
                    }
                });
        return completion;
    }

    /**
     * Releases the channel after the broker ended the subscription on its own.
     */
    public void abandon() {
        if (started.compareAndSet(false, true)) {
            consumer.markClosed();
            ChannelManager.closeQuietly(channel);
            completion.complete(null);
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    private void cancelConsumer() {
        try {
            channel.basicCancel(consumerTag);
        } catch (IOException | RuntimeException e) {
            throw AmqpErrors.translate(queue, "cancel consumer on", e);
        }
    }

    private void closeChannel() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            throw new TransportException("Failed to close channel consuming queue '" + queue + "'", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof MessageQueueException) {
            return cause;
        }
        return new TransportException("Shutdown failed", cause);
    }
}
