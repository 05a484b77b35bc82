package io.github.fedify.amqp.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import io.github.fedify.amqp.exception.ConfigurationConflictException;
import io.github.fedify.amqp.exception.MessageQueueException;
import io.github.fedify.amqp.exception.TransportException;

/**
 * Maps exceptions raised by the AMQP client to the queue's error taxonomy.
 */
public final class AmqpErrors {

    private AmqpErrors() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param queue     The queue the failed operation was about, used in messages.
     * @param operation A short description of the failed operation, e.g. "declare".
     * @param e         The exception raised by the client, usually an {@link java.io.IOException}
     *                  whose cause is a {@link ShutdownSignalException}.
     */
    public static MessageQueueException translate(String queue, String operation, Exception e) {
        if (e instanceof MessageQueueException) {
            return (MessageQueueException) e;
        }
        ShutdownSignalException signal = findShutdownSignal(e);
        if (signal != null && replyCode(signal) == AMQP.PRECONDITION_FAILED) {
            return new ConfigurationConflictException(queue,
                    "Queue '" + queue + "' already exists with different arguments: " + signal.getMessage(), e);
        }
        return new TransportException("Failed to " + operation + " queue '" + queue + "'", e);
    }

    static ShutdownSignalException findShutdownSignal(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ShutdownSignalException) {
                return (ShutdownSignalException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    static int replyCode(ShutdownSignalException signal) {
        Method reason = signal.getReason();
        if (reason instanceof AMQP.Channel.Close) {
            return ((AMQP.Channel.Close) reason).getReplyCode();
        }
        if (reason instanceof AMQP.Connection.Close) {
            return ((AMQP.Connection.Close) reason).getReplyCode();
        }
        return -1;
    }
}
