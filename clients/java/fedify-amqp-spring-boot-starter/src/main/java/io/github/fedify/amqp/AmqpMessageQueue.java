package io.github.fedify.amqp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import io.github.fedify.amqp.codec.JsonMessageCodec;
import io.github.fedify.amqp.config.AmqpMessageQueueOptions;
import io.github.fedify.amqp.connection.AmqpErrors;
import io.github.fedify.amqp.connection.ChannelManager;
import io.github.fedify.amqp.consumer.DeliveryConsumer;
import io.github.fedify.amqp.consumer.ShutdownCoordinator;
import io.github.fedify.amqp.exception.MessageQueueException;
import io.github.fedify.amqp.producer.AmqpPublisher;
import io.github.fedify.amqp.producer.DelayRouter;
import io.github.fedify.amqp.queue.CancellationSignal;
import io.github.fedify.amqp.queue.EnqueueOptions;
import io.github.fedify.amqp.queue.ListenOptions;
import io.github.fedify.amqp.queue.MessageHandler;
import io.github.fedify.amqp.queue.MessageQueue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link MessageQueue} on an AMQP 0-9-1 broker such as RabbitMQ.
 * <p>
 * Messages are JSON encoded and published through the default exchange. Delayed messages go to a per-delay queue
 * whose message TTL equals the delay and whose dead-letter target is the main queue, so the broker moves them into
 * the main queue once the delay has passed.
 * <p>
 * Listeners consume with a prefetch of one and acknowledge each message once its handler has finished, whether
 * it succeeded or failed.
 *
 * <pre>{@code
 * Connection connection = new ConnectionFactory().newConnection();
 * AmqpMessageQueue queue = new AmqpMessageQueue(connection);
 *
 * CancellationSignal signal = new CancellationSignal();
 * CompletableFuture<Void> listening = queue.listen(MessageHandler.of(System.out::println),
 *         ListenOptions.withSignal(signal));
 * queue.enqueue("Hello, world!");
 * queue.enqueue("Later", EnqueueOptions.delayed(Duration.ofSeconds(3)));
 * ...
 * signal.cancel();
 * listening.join();
 * }</pre>
 */
@Slf4j
public class AmqpMessageQueue implements MessageQueue, AutoCloseable {

    private final Connection connection;
    private final AmqpMessageQueueOptions options;
    private final JsonMessageCodec codec;
    private final ChannelManager channelManager;
    private final AmqpPublisher publisher;

    public AmqpMessageQueue(Connection connection) {
        this(connection, AmqpMessageQueueOptions.defaults());
    }

    public AmqpMessageQueue(Connection connection, AmqpMessageQueueOptions options) {
        this(connection, options, new JsonMessageCodec(new ObjectMapper()));
    }

    /**
     * @param connection A live connection to the broker. It is not closed by this queue.
     * @param options    Queue name, delay queue prefix and durability.
     * @param codec      The payload codec.
     */
    public AmqpMessageQueue(Connection connection, AmqpMessageQueueOptions options, JsonMessageCodec codec) {
        this.connection = connection;
        this.options = options;
        this.codec = codec;
        this.channelManager = new ChannelManager(connection, options.getQueue(), options.isDurable());
        DelayRouter delayRouter = new DelayRouter(options.getQueue(), options.getDelayedQueuePrefix(), options.isDurable());
        this.publisher = new AmqpPublisher(channelManager, delayRouter, codec);
        log.info("Created AMQP message queue {}", options);
    }

    @Override
    public void enqueue(Object message, EnqueueOptions enqueueOptions) {
        publisher.publish(message, enqueueOptions);
    }

    @Override
    public CompletableFuture<Void> listen(MessageHandler handler, ListenOptions listenOptions) {
        CancellationSignal signal = listenOptions == null ? null : listenOptions.getSignal();
        if (signal != null && signal.isCancelled()) {
            return CompletableFuture.completedFuture(null);
        }

        Channel channel;
        try {
            channel = channelManager.createListenChannel();
        } catch (MessageQueueException e) {
            return CompletableFuture.failedFuture(e);
        }

        DeliveryConsumer consumer = new DeliveryConsumer(channel, options.getQueue(), handler, codec);
        String consumerTag;
        try {
            channelManager.prepareQueue(channel);
            channel.basicQos(1);
            consumerTag = channel.basicConsume(options.getQueue(), false, consumer);
        } catch (IOException | RuntimeException e) {
            ChannelManager.closeQuietly(channel);
            return CompletableFuture.failedFuture(AmqpErrors.translate(options.getQueue(), "consume from", e));
        }

        ShutdownCoordinator coordinator = new ShutdownCoordinator(channel, consumer, consumerTag, options.getQueue());
        CompletableFuture<Void> listening = new CompletableFuture<>();

        consumer.subscriptionLost().whenComplete((ignored, error) -> {
            if (error != null && !coordinator.isStarted()) {
                coordinator.abandon();
                listening.completeExceptionally(error);
            }
        });
        if (signal != null) {
            signal.onCancel(() -> coordinator.shutdown().whenComplete((ignored, error) -> {
                if (error == null) {
                    listening.complete(null);
                } else {
                    listening.completeExceptionally(error);
                }
            }));
        }
        return listening;
    }

    /**
     * Closes the shared publish channel. Running listeners and the connection are left alone.
     */
    @Override
    public void close() {
        channelManager.close();
    }

    public AmqpMessageQueueOptions getOptions() {
        return options;
    }

    public JsonMessageCodec getCodec() {
        return codec;
    }

    public Connection getConnection() {
        return connection;
    }
}
