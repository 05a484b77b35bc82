package io.github.fedify.amqp.queue;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ListenOptions {

    /**
     * Stops the listener when cancelled. A listener without a signal runs until its subscription is lost.
     */
    private final CancellationSignal signal;

    public static ListenOptions none() {
        return ListenOptions.builder().build();
    }

    public static ListenOptions withSignal(CancellationSignal signal) {
        return ListenOptions.builder().signal(signal).build();
    }
}
