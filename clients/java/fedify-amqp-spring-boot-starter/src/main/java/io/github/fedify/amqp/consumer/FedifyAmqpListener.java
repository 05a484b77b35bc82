package io.github.fedify.amqp.consumer;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as a listener of the configured queue.
 * <p>
 * The method takes exactly one parameter, the payload, converted from the decoded JSON to the parameter's type.
 * If it returns a {@link java.util.concurrent.CompletionStage}, the message is acknowledged once that stage
 * completes; otherwise once the method returns or throws.
 */
@Target(ElementType.METHOD) // This annotation can only be applied to methods
@Retention(RetentionPolicy.RUNTIME) // The annotation should be available at runtime for processing
public @interface FedifyAmqpListener {

    /**
     * A unique identifier for this listener container.
     * If not specified, one is derived from the bean and method names.
     */
    String id() default "";
}
