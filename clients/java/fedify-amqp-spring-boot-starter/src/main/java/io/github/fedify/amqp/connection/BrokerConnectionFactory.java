package io.github.fedify.amqp.connection;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.github.fedify.amqp.config.FedifyAmqpProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

/**
 * Builds plain broker connections from {@link FedifyAmqpProperties}.
 * Connections are not pooled and not recovered automatically; a lost connection surfaces as a transport error.
 */
@Slf4j
public class BrokerConnectionFactory {

    private final ConnectionFactory connectionFactory;

    public BrokerConnectionFactory(FedifyAmqpProperties properties) {
        this(properties, new ConnectionFactory());
    }

    BrokerConnectionFactory(FedifyAmqpProperties properties, ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        String finalHost;
        int finalPort;

        try {
            // Prefer the URI when it names both a host and a port
            URI brokerUri = new URI(properties.getUri());
            finalHost = brokerUri.getHost();
            finalPort = brokerUri.getPort();

            if (finalHost == null || finalPort == -1) {
                throw new IllegalArgumentException("Host or Port not found in the provided URI: " + properties.getUri());
            }
            log.info("Successfully parsed broker URI. Host='{}', Port='{}'", finalHost, finalPort);
        } catch (Exception e) {
            log.warn("Could not parse 'uri' property. Falling back to separate 'host' and 'port' properties. Reason: {}", e.getMessage());
            finalHost = properties.getHost();
            try {
                finalPort = Integer.parseInt(properties.getPort());
            } catch (NumberFormatException nfe) {
                log.error("The configured 'port' property is not a valid number: '{}'", properties.getPort());
                throw new IllegalArgumentException("Invalid port number configured: " + properties.getPort(), nfe);
            }
        }

        connectionFactory.setHost(finalHost);
        connectionFactory.setPort(finalPort);
        connectionFactory.setUsername(properties.getUsername());
        connectionFactory.setPassword(properties.getPassword());
        connectionFactory.setVirtualHost(properties.getVirtualHost());
        connectionFactory.setConnectionTimeout(properties.getConnectionTimeout());
        connectionFactory.setAutomaticRecoveryEnabled(false);
    }

    public Connection newConnection() throws IOException, TimeoutException {
        log.info("Opening a new broker connection to {}:{}", connectionFactory.getHost(), connectionFactory.getPort());
        return connectionFactory.newConnection("fedify-amqp");
    }

    ConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }
}
