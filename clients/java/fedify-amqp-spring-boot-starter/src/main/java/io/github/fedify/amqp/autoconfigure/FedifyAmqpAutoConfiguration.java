package io.github.fedify.amqp.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Connection;
import io.github.fedify.amqp.AmqpMessageQueue;
import io.github.fedify.amqp.codec.JsonMessageCodec;
import io.github.fedify.amqp.config.AmqpMessageQueueOptions;
import io.github.fedify.amqp.config.FedifyAmqpProperties;
import io.github.fedify.amqp.connection.BrokerConnectionFactory;
import io.github.fedify.amqp.consumer.FedifyAmqpListenerAnnotationBeanPostProcessor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

@Configuration(proxyBeanMethods = false)
@ConditionalOnClass({AmqpMessageQueue.class, Connection.class}) // Only activate if the queue and the client are present
@ConditionalOnProperty(prefix = "fedify.amqp", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FedifyAmqpProperties.class)
public class FedifyAmqpAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnectionFactory brokerConnectionFactory(FedifyAmqpProperties properties) {
        return new BrokerConnectionFactory(properties);
    }

    /**
     * A plain broker connection, unless the application provides its own.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean // Allow users to provide their own Connection bean
    public Connection fedifyAmqpConnection(BrokerConnectionFactory brokerConnectionFactory)
            throws IOException, TimeoutException {
        return brokerConnectionFactory.newConnection();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonMessageCodec jsonMessageCodec(ObjectMapper objectMapper) {
        return new JsonMessageCodec(objectMapper);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public AmqpMessageQueue amqpMessageQueue(Connection connection, JsonMessageCodec codec,
                                             FedifyAmqpProperties properties) {
        return new AmqpMessageQueue(connection, AmqpMessageQueueOptions.from(properties), codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public static FedifyAmqpListenerAnnotationBeanPostProcessor fedifyAmqpListenerAnnotationBeanPostProcessor() {
        return new FedifyAmqpListenerAnnotationBeanPostProcessor();
    }

    /**
     * Provides a default ObjectMapper bean if one is not already present.
     * Many applications will already have one.
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
