package com.aporkolab.deadletter.routing;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.deadletter.exception.TransportException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Publishes the original body, untouched, to a dead letter exchange.
 * No retries: a failed publish fails the whole routing attempt.
 */
public class Republisher {

    private static final Logger log = LoggerFactory.getLogger(Republisher.class);

    static final int PERSISTENT_DELIVERY_MODE = 2;

    public void publish(Channel channel, String exchange, String routingKey, String deadLetterType, byte[] body) {
        publish(channel, exchange, routingKey, deadLetterType, null, body);
    }

    public void publish(Channel channel, String exchange, String routingKey, String deadLetterType,
                        String correlationId, byte[] body) {
        AMQP.BasicProperties properties = properties(deadLetterType, correlationId);
        try {
            channel.basicPublish(exchange, routingKey, properties, body);
        } catch (IOException | ShutdownSignalException e) {
            throw TransportException.publish(exchange, e);
        }
        log.debug("Republished {} byte(s) to exchange '{}' with routing key '{}' as type '{}'",
                body.length, exchange, routingKey, deadLetterType);
    }

    AMQP.BasicProperties properties(String deadLetterType, String correlationId) {
        return new AMQP.BasicProperties.Builder()
                .type(deadLetterType)
                .deliveryMode(PERSISTENT_DELIVERY_MODE)
                .correlationId(correlationId)
                .build();
    }
}
