package io.github.fedify.amqp.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Construction-time settings of an {@link io.github.fedify.amqp.AmqpMessageQueue}. Immutable.
 */
@Getter
@Builder
@ToString
public class AmqpMessageQueueOptions {

    public static final String DEFAULT_QUEUE = "fedify_queue";
    public static final String DEFAULT_DELAYED_QUEUE_PREFIX = "fedify_delayed_";

    @Builder.Default
    private final String queue = DEFAULT_QUEUE;

    @Builder.Default
    private final String delayedQueuePrefix = DEFAULT_DELAYED_QUEUE_PREFIX;

    @Builder.Default
    private final boolean durable = true;

    public static AmqpMessageQueueOptions defaults() {
        return AmqpMessageQueueOptions.builder().build();
    }

    public static AmqpMessageQueueOptions from(FedifyAmqpProperties properties) {
        return AmqpMessageQueueOptions.builder()
                .queue(properties.getQueue())
                .delayedQueuePrefix(properties.getDelayedQueuePrefix())
                .durable(properties.isDurable())
                .build();
    }
}
