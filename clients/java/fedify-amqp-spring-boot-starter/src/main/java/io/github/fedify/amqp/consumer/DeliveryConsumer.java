package io.github.fedify.amqp.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.github.fedify.amqp.codec.JsonMessageCodec;
import io.github.fedify.amqp.exception.EncodingException;
import io.github.fedify.amqp.exception.TransportException;
import io.github.fedify.amqp.queue.MessageHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The consumer loop of one listen session. Relies on a prefetch of one: the broker sends the next message only
 * after the current one is acknowledged, and the acknowledgment is sent only once the handler is done with it.
 * <p>
 * Handler failures are logged and the message is acknowledged anyway. Messages whose body cannot be decoded are
 * rejected without requeue. Deliveries that arrive once cancellation has begun are rejected with requeue so
 * another consumer picks them up.
 */
@Slf4j
public class DeliveryConsumer extends DefaultConsumer {

    private final String queue;
    private final MessageHandler handler;
    private final JsonMessageCodec codec;

    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.IDLE);
    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();
    private final CompletableFuture<Void> subscriptionLost = new CompletableFuture<>();
    private volatile CompletableFuture<Void> inFlight = CompletableFuture.completedFuture(null);

    public DeliveryConsumer(Channel channel, String queue, MessageHandler handler, JsonMessageCodec codec) {
        super(channel);
        this.queue = queue;
        this.handler = handler;
        this.codec = codec;
    }

    @Override
    public void handleConsumeOk(String consumerTag) {
        super.handleConsumeOk(consumerTag);
        if (state.compareAndSet(ConsumerState.IDLE, ConsumerState.SUBSCRIBED)) {
            log.info("Subscribed to queue [{}] with consumer tag [{}]", queue, consumerTag);
        }
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        long deliveryTag = envelope.getDeliveryTag();
        // consume-ok is always dispatched before the first delivery, but be lenient about it
        state.compareAndSet(ConsumerState.IDLE, ConsumerState.SUBSCRIBED);
        if (!beginDelivery()) {
            log.warn("Delivery [{}] on queue [{}] arrived in state {}; requeueing it.", deliveryTag, queue, state.get());
            reject(deliveryTag, true);
            return;
        }

        CompletableFuture<Void> done = new CompletableFuture<>();
        inFlight = done;

        Object message;
        try {
            message = codec.decode(body);
        } catch (EncodingException e) {
            log.error("Dropping undecodable delivery [{}] on queue [{}] (content type {}).",
                    deliveryTag, queue, properties == null ? null : properties.getContentType(), e);
            reject(deliveryTag, false);
            state.compareAndSet(ConsumerState.DELIVERING, ConsumerState.SUBSCRIBED);
            done.complete(null);
            return;
        }

        invoke(message).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Handler failed for delivery [{}] on queue [{}]. Acknowledging it anyway.",
                        deliveryTag, queue, error);
            }
            state.compareAndSet(ConsumerState.DELIVERING, ConsumerState.ACKING);
            ack(deliveryTag);
            state.compareAndSet(ConsumerState.ACKING, ConsumerState.SUBSCRIBED);
            done.complete(null);
        });
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        log.info("Consumer [{}] on queue [{}] cancelled.", consumerTag, queue);
        cancelled.complete(null);
    }

    @Override
    public void handleCancel(String consumerTag) {
        log.warn("Consumer [{}] on queue [{}] was cancelled by the broker.", consumerTag, queue);
        cancelled.complete(null);
        subscriptionLost.completeExceptionally(
                new TransportException("Subscription to queue '" + queue + "' was cancelled by the broker"));
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        cancelled.complete(null);
        if (isStopping()) {
            log.debug("Channel of consumer [{}] on queue [{}] shut down.", consumerTag, queue);
            return;
        }
        log.warn("Channel of consumer [{}] on queue [{}] shut down unexpectedly: {}", consumerTag, queue, sig.getMessage());
        subscriptionLost.completeExceptionally(
                new TransportException("Channel consuming queue '" + queue + "' was shut down", sig));
    }

    /**
     * Stops handing new deliveries to the handler. The in-flight delivery, if any, still completes and is acked.
     */
    void markCancelling() {
        state.set(ConsumerState.CANCELLING);
    }

    void markClosed() {
        state.set(ConsumerState.CLOSED);
    }

    public ConsumerState getState() {
        return state.get();
    }

    /**
     * Completes once the broker has confirmed that no further deliveries will be dispatched to this consumer.
     */
    CompletableFuture<Void> cancelled() {
        return cancelled;
    }

    /**
     * Completes once the current delivery, if any, has been acked or rejected.
     */
    CompletableFuture<Void> inFlight() {
        return inFlight;
    }

    /**
     * Completes exceptionally if the broker ends the subscription without being asked to. Never completes normally.
     */
    public CompletableFuture<Void> subscriptionLost() {
        return subscriptionLost;
    }

    private boolean isStopping() {
        ConsumerState current = state.get();
        return current == ConsumerState.CANCELLING || current == ConsumerState.CLOSED;
    }

    /**
     * Moves to DELIVERING from SUBSCRIBED, or from ACKING: with a prefetch of one the broker only dispatches the
     * next message once the previous ack has reached it, which can happen before the acking thread has stepped
     * back to SUBSCRIBED.
     */
    private boolean beginDelivery() {
        while (true) {
            ConsumerState current = state.get();
            if (current != ConsumerState.SUBSCRIBED && current != ConsumerState.ACKING) {
                return false;
            }
            if (state.compareAndSet(current, ConsumerState.DELIVERING)) {
                return true;
            }
        }
    }

    private CompletionStage<Void> invoke(Object message) {
        try {
            CompletionStage<Void> result = handler.handle(message);
            return result == null ? CompletableFuture.completedFuture(null) : result;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void ack(long deliveryTag) {
        try {
            getChannel().basicAck(deliveryTag, false);
            log.trace("Acknowledged delivery [{}] on queue [{}]", deliveryTag, queue);
        } catch (IOException | RuntimeException e) {
            // The broker redelivers unacked messages once the channel is gone
            log.warn("Failed to acknowledge delivery [{}] on queue [{}]; it will be redelivered.", deliveryTag, queue, e);
        }
    }

    private void reject(long deliveryTag, boolean requeue) {
        try {
            getChannel().basicReject(deliveryTag, requeue);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to reject delivery [{}] on queue [{}].", deliveryTag, queue, e);
        }
    }
}
