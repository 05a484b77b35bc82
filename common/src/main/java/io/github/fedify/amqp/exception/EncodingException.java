package io.github.fedify.amqp.exception;

/**
 * A payload could not be encoded to, or decoded from, its wire format.
 */
public class EncodingException extends MessageQueueException {

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
