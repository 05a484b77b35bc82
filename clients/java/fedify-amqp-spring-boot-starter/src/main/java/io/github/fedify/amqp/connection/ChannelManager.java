package io.github.fedify.amqp.connection;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import io.github.fedify.amqp.exception.MessageQueueException;
import io.github.fedify.amqp.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the channels a queue uses on a caller-supplied connection: one cached channel shared by all publishes,
 * and a fresh channel for every listen session. The connection itself is never closed here.
 */
@Slf4j
public class ChannelManager {

    private final Connection connection;
    private final String queue;
    private final boolean durable;

    // Holds the one publish channel, or the creation in progress. Cleared when the channel is found closed.
    private final AtomicReference<CompletableFuture<Channel>> publishChannel = new AtomicReference<>();

    public ChannelManager(Connection connection, String queue, boolean durable) {
        this.connection = connection;
        this.queue = queue;
        this.durable = durable;
    }

    /**
     * Returns the shared publish channel, creating it and declaring the main queue on first use.
     * Concurrent first callers wait for a single creation.
     *
     * @throws TransportException if the channel cannot be opened, or the cached one has been closed.
     *                            The cache is cleared so that a later call opens a new channel.
     * @throws io.github.fedify.amqp.exception.ConfigurationConflictException if the main queue exists with
     *                            different arguments.
     */
    public Channel getPublishChannel() {
        while (true) {
            CompletableFuture<Channel> current = publishChannel.get();
            if (current == null) {
                CompletableFuture<Channel> creation = new CompletableFuture<>();
                if (!publishChannel.compareAndSet(null, creation)) {
                    continue; // another caller won the race
                }
                return createPublishChannel(creation);
            }

            Channel channel = await(current);
            if (channel.isOpen()) {
                return channel;
            }
            publishChannel.compareAndSet(current, null);
            throw new TransportException("Publish channel for queue '" + queue + "' is closed",
                    channel.getCloseReason());
        }
    }

    private Channel createPublishChannel(CompletableFuture<Channel> creation) {
        try {
            Channel channel = openChannel();
            try {
                prepareQueue(channel);
            } catch (MessageQueueException e) {
                closeQuietly(channel);
                throw e;
            }
            log.info("Opened publish channel #{} for queue [{}]", channel.getChannelNumber(), queue);
            creation.complete(channel);
            return channel;
        } catch (RuntimeException e) {
            publishChannel.compareAndSet(creation, null);
            creation.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Opens a new channel for one listen session. The caller owns and closes it.
     */
    public Channel createListenChannel() {
        Channel channel = openChannel();
        log.debug("Opened listen channel #{} for queue [{}]", channel.getChannelNumber(), queue);
        return channel;
    }

    /**
     * Declares the main queue with the configured durability. Idempotent for identical arguments.
     *
     * @throws io.github.fedify.amqp.exception.ConfigurationConflictException if the queue exists with
     *                                                                     different arguments.
     * @throws TransportException for any other failure.
     */
    public void prepareQueue(Channel channel) {
        try {
            channel.queueDeclare(queue, durable, false, false, null);
            log.debug("Declared queue [{}] (durable={})", queue, durable);
        } catch (IOException | RuntimeException e) {
            throw AmqpErrors.translate(queue, "declare", e);
        }
    }

    /**
     * Closes the cached publish channel, if one is open.
     */
    public void close() {
        CompletableFuture<Channel> current = publishChannel.getAndSet(null);
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return;
        }
        Channel channel = current.join();
        if (channel.isOpen()) {
            log.info("Closing publish channel #{} for queue [{}]", channel.getChannelNumber(), queue);
            closeQuietly(channel);
        }
    }

    public String getQueue() {
        return queue;
    }

    public boolean isDurable() {
        return durable;
    }

    private Channel openChannel() {
        Channel channel;
        try {
            channel = connection.createChannel();
        } catch (IOException | RuntimeException e) {
            throw AmqpErrors.translate(queue, "open a channel for", e);
        }
        if (channel == null) {
            throw new TransportException("No channel available on the connection for queue '" + queue + "'");
        }
        return channel;
    }

    private static Channel await(CompletableFuture<Channel> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof MessageQueueException) {
                throw (MessageQueueException) e.getCause();
            }
            throw new TransportException("Failed to open publish channel", e.getCause());
        }
    }

    public static void closeQuietly(Channel channel) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Failed to close channel #{} cleanly.", channel.getChannelNumber(), e);
        }
    }
}
