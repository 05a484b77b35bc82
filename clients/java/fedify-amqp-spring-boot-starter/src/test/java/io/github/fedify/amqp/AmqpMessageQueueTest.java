package io.github.fedify.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.github.fedify.amqp.config.AmqpMessageQueueOptions;
import io.github.fedify.amqp.exception.ConfigurationConflictException;
import io.github.fedify.amqp.exception.TransportException;
import io.github.fedify.amqp.queue.CancellationSignal;
import io.github.fedify.amqp.queue.EnqueueOptions;
import io.github.fedify.amqp.queue.ListenOptions;
import io.github.fedify.amqp.queue.MessageHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AmqpMessageQueueTest {

    private static final String TAG = "amq.ctag-1";

    @Mock
    private Connection connection;

    @Mock
    private Channel channel;

    private final AtomicReference<Consumer> subscribed = new AtomicReference<>();
    private AmqpMessageQueue queue;

    @BeforeEach
    void setUp() {
        queue = new AmqpMessageQueue(connection, AmqpMessageQueueOptions.defaults());
    }

    private void brokerAcceptsSubscriptions() throws IOException {
        when(connection.createChannel()).thenReturn(channel);
        when(channel.basicConsume(eq("fedify_queue"), eq(false), any(Consumer.class))).thenAnswer(invocation -> {
            Consumer consumer = invocation.getArgument(2);
            subscribed.set(consumer);
            consumer.handleConsumeOk(TAG);
            return TAG;
        });
    }

    private void brokerConfirmsCancellation() throws IOException {
        doAnswer(invocation -> {
            subscribed.get().handleCancelOk(TAG);
            return null;
        }).when(channel).basicCancel(TAG);
    }

    @Test
    void listenDeclaresTheQueueAndSubscribesWithPrefetchOneAndManualAck() throws Exception {
        brokerAcceptsSubscriptions();

        CompletableFuture<Void> listening = queue.listen(MessageHandler.of(message -> { }));

        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).queueDeclare("fedify_queue", true, false, false, null);
        inOrder.verify(channel).basicQos(1);
        inOrder.verify(channel).basicConsume(eq("fedify_queue"), eq(false), any(Consumer.class));
        assertThat(listening).isNotDone();
    }

    @Test
    void enqueuedMessageReachesTheHandlerAndIsAcknowledged() throws Exception {
        brokerAcceptsSubscriptions();
        List<Object> received = new ArrayList<>();
        queue.listen(MessageHandler.of(received::add));

        queue.enqueue("Hello, world!");

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel).basicPublish(eq(""), eq("fedify_queue"), properties.capture(), body.capture());

        // Hand the published bytes back as the broker would
        subscribed.get().handleDelivery(TAG, new Envelope(1, false, "", "fedify_queue"),
                properties.getValue(), body.getValue());

        assertThat(received).containsExactly("Hello, world!");
        verify(channel).basicAck(1, false);
    }

    @Test
    void publishChannelIsSharedAcrossEnqueues() throws Exception {
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);

        queue.enqueue("one");
        queue.enqueue("two");
        queue.enqueue("three", EnqueueOptions.delayed(Duration.ofSeconds(1)));

        verify(connection, times(1)).createChannel();
        verify(channel, times(3)).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    }

    @Test
    void cancellationStopsTheListenerAndClosesItsChannel() throws Exception {
        brokerAcceptsSubscriptions();
        brokerConfirmsCancellation();
        when(channel.isOpen()).thenReturn(true);
        CancellationSignal signal = new CancellationSignal();

        CompletableFuture<Void> listening = queue.listen(MessageHandler.of(message -> { }), ListenOptions.withSignal(signal));
        signal.cancel();

        listening.get(5, TimeUnit.SECONDS);
        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).basicCancel(TAG);
        inOrder.verify(channel).close();
        verify(connection, never()).close();
    }

    @Test
    void inFlightHandlerCompletesBeforeTheListenerResolves() throws Exception {
        brokerAcceptsSubscriptions();
        brokerConfirmsCancellation();
        when(channel.isOpen()).thenReturn(true);
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<Void> work = new CompletableFuture<>();

        CompletableFuture<Void> listening = queue.listen(message -> work, ListenOptions.withSignal(signal));
        subscribed.get().handleDelivery(TAG, new Envelope(1, false, "", "fedify_queue"),
                new AMQP.BasicProperties(), "\"busy\"".getBytes());
        signal.cancel();

        verify(channel, timeout(2000)).basicCancel(TAG);
        Thread.sleep(100);
        assertThat(listening).isNotDone();

        // Nothing is handed to the handler once cancellation began
        subscribed.get().handleDelivery(TAG, new Envelope(2, false, "", "fedify_queue"),
                new AMQP.BasicProperties(), "\"late\"".getBytes());
        verify(channel).basicReject(2, true);

        work.complete(null);
        listening.get(5, TimeUnit.SECONDS);

        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).basicAck(1, false);
        inOrder.verify(channel).close();
    }

    @Test
    void alreadyCancelledSignalNeverSubscribes() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        CompletableFuture<Void> listening = queue.listen(MessageHandler.of(message -> { }), ListenOptions.withSignal(signal));

        assertThat(listening).isCompleted();
        verifyNoInteractions(connection);
    }

    @Test
    void setupFailureFailsTheListenerAndReleasesTheChannel() throws Exception {
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        when(channel.basicConsume(anyString(), anyBoolean(), any(Consumer.class))).thenThrow(new IOException("connection reset"));

        CompletableFuture<Void> listening = queue.listen(MessageHandler.of(message -> { }));

        assertThatThrownBy(() -> listening.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TransportException.class);
        verify(channel).close();
    }

    @Test
    void conflictingQueueFailsTheListener() throws Exception {
        when(connection.createChannel()).thenReturn(channel);
        ShutdownSignalException conflict = new ShutdownSignalException(false, false,
                new AMQP.Channel.Close.Builder().replyCode(406).replyText("PRECONDITION_FAILED").build(), null);
        when(channel.queueDeclare("fedify_queue", true, false, false, null)).thenThrow(new IOException(conflict));

        CompletableFuture<Void> listening = queue.listen(MessageHandler.of(message -> { }));

        assertThatThrownBy(() -> listening.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(ConfigurationConflictException.class);
    }

    @Test
    void lostChannelFailsTheListener() throws Exception {
        brokerAcceptsSubscriptions();

        CompletableFuture<Void> listening = queue.listen(MessageHandler.of(message -> { }));
        subscribed.get().handleShutdownSignal(TAG, new ShutdownSignalException(true, false, null, null));

        assertThatThrownBy(() -> listening.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TransportException.class);
    }
}
