package io.github.fedify.amqp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "fedify.amqp")
public class FedifyAmqpProperties {

    /**
     * Enable fedify-amqp auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Broker URI. Takes precedence over host and port when it names both.
     */
    private String uri = "amqp://localhost:5672";

    /**
     * Broker host, used when the URI cannot be parsed.
     */
    private String host = "localhost";

    /**
     * Broker port, used when the URI cannot be parsed.
     */
    private String port = "5672";

    private String username = "guest";

    private String password = "guest";

    private String virtualHost = "/";

    /**
     * Connection timeout in milliseconds.
     */
    private int connectionTimeout = 5000; // 5 seconds

    /**
     * Name of the main queue. All producers and consumers of a deployment must agree on it.
     */
    private String queue = "fedify_queue";

    /**
     * Prefix of the per-delay queues. The delay in milliseconds is appended to it.
     */
    private String delayedQueuePrefix = "fedify_delayed_";

    /**
     * Whether queues and messages survive a broker restart.
     */
    private boolean durable = true;

    /**
     * Consumer specific configurations.
     */
    private Consumer consumer = new Consumer();

    @Data
    public static class Consumer {
        /**
         * Enable the consumer functionality.
         * Listeners will only be activated if this is true.
         */
        private boolean enabled = true;

        /**
         * How long to wait, in milliseconds, for a listener's in-flight message on application shutdown.
         */
        private long shutdownTimeoutMillis = 30000; // 30 seconds
    }
}
