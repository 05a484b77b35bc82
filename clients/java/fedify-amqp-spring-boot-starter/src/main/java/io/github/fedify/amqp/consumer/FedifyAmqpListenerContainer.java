package io.github.fedify.amqp.consumer;

import io.github.fedify.amqp.codec.JsonMessageCodec;
import io.github.fedify.amqp.queue.CancellationSignal;
import io.github.fedify.amqp.queue.ListenOptions;
import io.github.fedify.amqp.queue.MessageQueue;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one {@link FedifyAmqpListener} method as a listen session on a {@link MessageQueue}.
 */
@Slf4j
public class FedifyAmqpListenerContainer {

    private final MessageQueue messageQueue;
    private final JsonMessageCodec codec;
    private final Object bean;
    private final Method method;
    private final String id;
    private final long shutdownTimeoutMillis;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile CancellationSignal signal;
    private volatile CompletableFuture<Void> listening;

    public FedifyAmqpListenerContainer(MessageQueue messageQueue, JsonMessageCodec codec, Object bean, Method method,
                                       String id, long shutdownTimeoutMillis) {
        this.messageQueue = messageQueue;
        this.codec = codec;
        this.bean = bean;
        this.method = method;
        this.id = id;
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting listener [{}] on method [{}]", id, method.getName());
            signal = new CancellationSignal();
            listening = messageQueue.listen(this::invoke, ListenOptions.withSignal(signal));
            listening.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Listener [{}] stopped with an error.", id, error);
                    running.set(false);
                }
            });
        }
    }

    /**
     * Cancels the listen session and waits for it to finish, bounded by the shutdown timeout.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping listener [{}]", id);
            signal.cancel();
            try {
                listening.get(shutdownTimeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                log.info("Listener [{}] was interrupted while stopping.", id);
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.warn("Listener [{}] did not stop cleanly.", id, e.getCause());
            } catch (TimeoutException e) {
                log.warn("Listener [{}] did not stop within {} ms.", id, shutdownTimeoutMillis);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getId() {
        return id;
    }

    CompletionStage<Void> invoke(Object payload) {
        try {
            Object argument = codec.convert(payload, method.getParameterTypes()[0]);
            Object result = method.invoke(bean, argument);
            if (result instanceof CompletionStage) {
                return ((CompletionStage<?>) result).thenApply(ignored -> null);
            }
            return CompletableFuture.completedFuture(null);
        } catch (InvocationTargetException e) {
            return CompletableFuture.failedFuture(e.getTargetException());
        } catch (IllegalAccessException | RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
