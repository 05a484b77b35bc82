package io.github.fedify.amqp.consumer;

import io.github.fedify.amqp.AmqpMessageQueue;
import io.github.fedify.amqp.codec.JsonMessageCodec;
import io.github.fedify.amqp.config.FedifyAmqpProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Finds {@link FedifyAmqpListener} methods and runs a {@link FedifyAmqpListenerContainer} for each.
 * Containers are stopped when the context closes, before the queue and the connection are destroyed.
 */
@Slf4j
public class FedifyAmqpListenerAnnotationBeanPostProcessor
        implements BeanPostProcessor, ApplicationContextAware, ApplicationListener<ContextClosedEvent> {

    private ApplicationContext applicationContext;

    // Dependencies will be lazily initialized later
    private AmqpMessageQueue messageQueue;
    private JsonMessageCodec codec;
    private FedifyAmqpProperties properties;

    private final List<FedifyAmqpListenerContainer> containers = new CopyOnWriteArrayList<>();

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        Class<?> targetClass = bean.getClass();
        ReflectionUtils.doWithMethods(targetClass, method -> {
            FedifyAmqpListener annotation = AnnotationUtils.findAnnotation(method, FedifyAmqpListener.class);
            if (annotation != null) {
                validateListenerMethod(method);
                initDependenciesIfNecessary();

                // We only start listeners if the consumer is enabled in properties
                if (!properties.getConsumer().isEnabled()) {
                    log.debug("Consumer disabled; not starting listener on method [{}]", method.getName());
                    return;
                }

                String id = StringUtils.hasText(annotation.id())
                        ? annotation.id()
                        : beanName + "#" + method.getName();
                log.info("Found listener [{}] on method [{}] for queue [{}]", id, method.getName(),
                        messageQueue.getOptions().getQueue());
                processListenerMethod(bean, method, id);
            }
        }, ReflectionUtils.USER_DECLARED_METHODS);

        return bean;
    }

    /**
     * Lazily initializes dependencies from the ApplicationContext on first use.
     * This prevents the chicken-and-egg problem during startup.
     */
    private void initDependenciesIfNecessary() {
        if (this.messageQueue == null) {
            this.messageQueue = this.applicationContext.getBean(AmqpMessageQueue.class);
            this.codec = this.applicationContext.getBean(JsonMessageCodec.class);
            this.properties = this.applicationContext.getBean(FedifyAmqpProperties.class);
        }
    }

    private void processListenerMethod(Object bean, Method method, String id) {
        ReflectionUtils.makeAccessible(method);
        FedifyAmqpListenerContainer container = new FedifyAmqpListenerContainer(messageQueue, codec, bean, method, id,
                properties.getConsumer().getShutdownTimeoutMillis());
        containers.add(container);
        container.start();
    }

    static void validateListenerMethod(Method method) {
        int parameterCount = method.getParameterCount();
        if (parameterCount == 0) {
            throw new IllegalArgumentException("Method " + method.getName()
                    + " annotated with @FedifyAmqpListener must have a parameter for the payload.");
        }
        if (parameterCount > 1) {
            throw new IllegalArgumentException("Method " + method.getName()
                    + " annotated with @FedifyAmqpListener must have exactly one parameter. Found: " + parameterCount);
        }
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        if (event.getApplicationContext() == applicationContext) {
            shutdown();
        }
    }

    @PreDestroy
    public void shutdown() {
        containers.forEach(FedifyAmqpListenerContainer::stop);
    }

    List<FedifyAmqpListenerContainer> getContainers() {
        return containers;
    }
}
