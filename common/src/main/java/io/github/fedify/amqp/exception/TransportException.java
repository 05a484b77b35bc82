package io.github.fedify.amqp.exception;

/**
 * The broker connection or channel is unusable. Never retried by the queue itself.
 */
public class TransportException extends MessageQueueException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
