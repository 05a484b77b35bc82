package io.github.fedify.amqp.producer;

import com.rabbitmq.client.Channel;
import io.github.fedify.amqp.connection.AmqpErrors;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns "deliver after N milliseconds" into broker primitives.
 * <p>
 * Each distinct delay gets its own queue, named {@code <prefix><delay-ms>}, whose messages expire after the delay
 * and are then dead-lettered through the default exchange into the main queue. The queue is auto-delete, so the
 * broker reclaims it; nothing here ever deletes it.
 */
@Slf4j
public class DelayRouter {

    static final String MESSAGE_TTL = "x-message-ttl";
    static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

    // The nameless default exchange routes by queue name
    private static final String DEFAULT_EXCHANGE = "";

    private final String queue;
    private final String delayedQueuePrefix;
    private final boolean durable;

    public DelayRouter(String queue, String delayedQueuePrefix, boolean durable) {
        this.queue = queue;
        this.delayedQueuePrefix = delayedQueuePrefix;
        this.durable = durable;
    }

    /**
     * Returns the queue a message with the given delay must be published to, declaring the delay queue first
     * when there is one. A {@code null}, zero or negative delay routes to the main queue.
     */
    public String route(Channel channel, Duration delay) {
        return route(channel, delayMillis(delay));
    }

    /**
     * Same as {@link #route(Channel, Duration)} for a delay already converted with {@link #delayMillis(Duration)}.
     */
    public String route(Channel channel, long delayMs) {
        if (delayMs <= 0) {
            return queue;
        }
        String delayQueue = delayQueueName(delayMs);
        try {
            channel.queueDeclare(delayQueue, durable, false, true, delayQueueArguments(delayMs));
        } catch (IOException | RuntimeException e) {
            throw AmqpErrors.translate(delayQueue, "declare", e);
        }
        log.debug("Declared delay queue [{}] dead-lettering into [{}] after {} ms", delayQueue, queue, delayMs);
        return delayQueue;
    }

    /**
     * Converts a delay to whole milliseconds. {@code null} becomes zero.
     *
     * @throws IllegalArgumentException if the delay does not fit in a {@code long} of milliseconds.
     */
    public long delayMillis(Duration delay) {
        if (delay == null) {
            return 0;
        }
        try {
            return delay.toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Delay is too long to express in milliseconds: " + delay, e);
        }
    }

    /**
     * The delay queue name for a delay. Plain decimal, so equal delays always share a queue.
     */
    public String delayQueueName(long delayMs) {
        return delayedQueuePrefix + Long.toString(delayMs);
    }

    Map<String, Object> delayQueueArguments(long delayMs) {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(MESSAGE_TTL, delayMs);
        arguments.put(DEAD_LETTER_EXCHANGE, DEFAULT_EXCHANGE);
        arguments.put(DEAD_LETTER_ROUTING_KEY, queue);
        return arguments;
    }
}
