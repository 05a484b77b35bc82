package io.github.fedify.amqp.queue;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@Builder
@ToString
public class EnqueueOptions {

    private static final EnqueueOptions NONE = EnqueueOptions.builder().build();

    /**
     * How long to hold the message before it becomes visible to listeners.
     * {@code null}, zero and negative durations mean no delay.
     */
    private final Duration delay;

    public static EnqueueOptions none() {
        return NONE;
    }

    public static EnqueueOptions delayed(Duration delay) {
        return EnqueueOptions.builder().delay(delay).build();
    }

    public boolean hasDelay() {
        return delay != null && !delay.isZero() && !delay.isNegative();
    }
}
