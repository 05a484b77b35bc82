package io.github.fedify.amqp.producer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.github.fedify.amqp.codec.JsonMessageCodec;
import io.github.fedify.amqp.connection.AmqpErrors;
import io.github.fedify.amqp.connection.ChannelManager;
import io.github.fedify.amqp.model.MessageEnvelope;
import io.github.fedify.amqp.queue.EnqueueOptions;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Encodes payloads and publishes them on the shared publish channel, either straight into the main queue or into
 * the delay queue chosen by the {@link DelayRouter}.
 */
@Slf4j
public class AmqpPublisher {

    private static final int NON_PERSISTENT = 1;
    private static final int PERSISTENT = 2;

    private final ChannelManager channelManager;
    private final DelayRouter delayRouter;
    private final JsonMessageCodec codec;

    public AmqpPublisher(ChannelManager channelManager, DelayRouter delayRouter, JsonMessageCodec codec) {
        this.channelManager = channelManager;
        this.delayRouter = delayRouter;
        this.codec = codec;
    }

    public void publish(Object message, EnqueueOptions options) {
        // Validate and encode first: a message that cannot be sent must not touch the broker
        long delayMs = delayRouter.delayMillis(options == null ? null : options.getDelay());
        MessageEnvelope envelope = codec.encode(message);

        Channel channel = channelManager.getPublishChannel();
        String target = delayRouter.route(channel, delayMs);

        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(envelope.getContentType())
                .deliveryMode(channelManager.isDurable() ? PERSISTENT : NON_PERSISTENT)
                .build();
        try {
            // Publishes on the shared channel must not interleave their frames
            synchronized (channel) {
                channel.basicPublish("", target, properties, envelope.getBody());
            }
        } catch (IOException | RuntimeException e) {
            throw AmqpErrors.translate(target, "publish to", e);
        }
        log.debug("Published {} to queue [{}]", envelope, target);
    }
}
