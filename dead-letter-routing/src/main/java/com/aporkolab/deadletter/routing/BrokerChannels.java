package com.aporkolab.deadletter.routing;

import java.util.function.Function;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.RabbitUtils;

import com.aporkolab.deadletter.exception.TransportException;
import com.rabbitmq.client.Channel;

/**
 * Runs work on a channel owned by a single invocation.
 * The channel is released on every exit path, the exceptional one included.
 */
final class BrokerChannels {

    private BrokerChannels() {}

    static <T> T execute(ConnectionFactory connectionFactory, Function<Channel, T> work) {
        try (Connection connection = open(connectionFactory)) {
            Channel channel = createChannel(connection);
            try {
                return work.apply(channel);
            } finally {
                RabbitUtils.closeChannel(channel);
            }
        }
    }

    private static Connection open(ConnectionFactory connectionFactory) {
        try {
            return connectionFactory.createConnection();
        } catch (AmqpException e) {
            throw TransportException.connection(e);
        }
    }

    private static Channel createChannel(Connection connection) {
        try {
            return connection.createChannel(false);
        } catch (AmqpException e) {
            throw TransportException.connection(e);
        }
    }
}
