package io.github.fedify.amqp;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.github.fedify.amqp.config.AmqpMessageQueueOptions;
import io.github.fedify.amqp.exception.ConfigurationConflictException;
import io.github.fedify.amqp.queue.CancellationSignal;
import io.github.fedify.amqp.queue.EnqueueOptions;
import io.github.fedify.amqp.queue.ListenOptions;
import io.github.fedify.amqp.queue.MessageHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the queue against a real RabbitMQ broker. Skipped when Docker is not available.
 */
@Tag("docker")
@Testcontainers(disabledWithoutDocker = true)
class AmqpMessageQueueIntegrationTest {

    @Container
    private static final RabbitMQContainer RABBIT = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.13-alpine"));

    private Connection connection;
    private Connection connection2;
    private AmqpMessageQueueOptions options;

    @BeforeEach
    void setUp() throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(RABBIT.getHost());
        factory.setPort(RABBIT.getAmqpPort());
        factory.setUsername(RABBIT.getAdminUsername());
        factory.setPassword(RABBIT.getAdminPassword());
        connection = factory.newConnection();
        connection2 = factory.newConnection();

        String suffix = UUID.randomUUID().toString().substring(0, 8);
        options = AmqpMessageQueueOptions.builder()
                .queue("fedify_queue_" + suffix)
                .delayedQueuePrefix("fedify_delayed_" + suffix + "_")
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
        connection2.close();
    }

    @Test
    void deliversImmediateAndDelayedMessagesAcrossTwoListeners() throws Exception {
        AmqpMessageQueue mq = new AmqpMessageQueue(connection, options);
        AmqpMessageQueue mq2 = new AmqpMessageQueue(connection2, options);
        List<Object> messages = Collections.synchronizedList(new ArrayList<>());
        CancellationSignal signal = new CancellationSignal();

        CompletableFuture<Void> listening = mq.listen(MessageHandler.of(messages::add), ListenOptions.withSignal(signal));
        CompletableFuture<Void> listening2 = mq2.listen(MessageHandler.of(messages::add), ListenOptions.withSignal(signal));

        mq.enqueue("Hello, world!");
        waitFor(() -> messages.size() > 0, 15_000);
        assertThat(messages).containsExactly("Hello, world!");

        long started = System.currentTimeMillis();
        mq.enqueue("Delayed message", EnqueueOptions.delayed(Duration.ofSeconds(3)));
        waitFor(() -> messages.size() > 1, 15_000);

        assertThat(messages).containsExactly("Hello, world!", "Delayed message");
        assertThat(System.currentTimeMillis() - started).isGreaterThanOrEqualTo(3_000);

        signal.cancel();
        listening.get(10, TimeUnit.SECONDS);
        listening2.get(10, TimeUnit.SECONDS);
        mq.close();
        mq2.close();
    }

    @Test
    void singleListenerObservesEnqueueOrder() throws Exception {
        AmqpMessageQueue mq = new AmqpMessageQueue(connection, options);
        List<Object> messages = Collections.synchronizedList(new ArrayList<>());
        CancellationSignal signal = new CancellationSignal();

        for (int i = 0; i < 10; i++) {
            mq.enqueue("m" + i);
        }
        CompletableFuture<Void> listening = mq.listen(MessageHandler.of(messages::add), ListenOptions.withSignal(signal));
        waitFor(() -> messages.size() == 10, 15_000);

        assertThat(messages).containsExactly("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9");
        signal.cancel();
        listening.get(10, TimeUnit.SECONDS);
    }

    @Test
    void twoListenersShareTheLoadWithoutDuplicatesOrDrops() throws Exception {
        AmqpMessageQueue mq = new AmqpMessageQueue(connection, options);
        AmqpMessageQueue mq2 = new AmqpMessageQueue(connection2, options);
        List<Object> messages = Collections.synchronizedList(new ArrayList<>());
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<Void> listening = mq.listen(MessageHandler.of(messages::add), ListenOptions.withSignal(signal));
        CompletableFuture<Void> listening2 = mq2.listen(MessageHandler.of(messages::add), ListenOptions.withSignal(signal));

        for (int i = 0; i < 40; i++) {
            mq.enqueue(i);
        }
        waitFor(() -> messages.size() >= 40, 15_000);
        Thread.sleep(500);

        assertThat(messages).hasSize(40);
        assertThat(new HashSet<>(messages)).hasSize(40);
        signal.cancel();
        listening.get(10, TimeUnit.SECONDS);
        listening2.get(10, TimeUnit.SECONDS);
    }

    @Test
    void cancellationWaitsForTheInFlightHandler() throws Exception {
        AmqpMessageQueue mq = new AmqpMessageQueue(connection, options);
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<Void> started = new CompletableFuture<>();
        CompletableFuture<Void> work = new CompletableFuture<>();
        List<Object> messages = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Void> listening = mq.listen(message -> {
            messages.add(message);
            started.complete(null);
            return work;
        }, ListenOptions.withSignal(signal));
        mq.enqueue("first");
        mq.enqueue("second");
        started.get(15, TimeUnit.SECONDS);

        signal.cancel();
        Thread.sleep(300);
        assertThat(listening).isNotDone();

        work.complete(null);
        listening.get(10, TimeUnit.SECONDS);
        assertThat(messages).containsExactly("first");

        // The second message is still on the queue for the next listener
        try (Channel channel = connection2.createChannel()) {
            assertThat(channel.messageCount(options.getQueue())).isEqualTo(1);
        }
    }

    @Test
    void nonDurableQueueCannotBeRedeclaredDurable() throws Exception {
        AmqpMessageQueueOptions transientOptions = AmqpMessageQueueOptions.builder()
                .queue(options.getQueue())
                .delayedQueuePrefix(options.getDelayedQueuePrefix())
                .durable(false)
                .build();
        new AmqpMessageQueue(connection, transientOptions).enqueue("transient");

        try (Channel channel = connection2.createChannel()) {
            assertThat(channel.messageCount(options.getQueue())).isEqualTo(1);
        }
        assertThatThrownBy(() -> new AmqpMessageQueue(connection2, options).enqueue("durable"))
                .isInstanceOf(ConfigurationConflictException.class);
    }

    private static void waitFor(BooleanSupplier predicate, long timeoutMillis) throws Exception {
        long started = System.currentTimeMillis();
        while (!predicate.getAsBoolean()) {
            Thread.sleep(100);
            if (System.currentTimeMillis() - started > timeoutMillis) {
                throw new TimeoutException("Condition not met within " + timeoutMillis + " ms");
            }
        }
    }
}
