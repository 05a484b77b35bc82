package io.github.fedify.amqp.exception;

/**
 * Base class of all errors raised by the message queue.
 */
public class MessageQueueException extends RuntimeException {

    public MessageQueueException(String message) {
        super(message);
    }

    public MessageQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
