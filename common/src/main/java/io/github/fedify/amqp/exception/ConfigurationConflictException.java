package io.github.fedify.amqp.exception;

import lombok.Getter;

/**
 * A queue already exists on the broker with arguments that differ from the ones being declared,
 * e.g. a different durability flag.
 */
@Getter
public class ConfigurationConflictException extends MessageQueueException {

    private final String queue;

    public ConfigurationConflictException(String queue, String message, Throwable cause) {
        super(message, cause);
        this.queue = queue;
    }
}
