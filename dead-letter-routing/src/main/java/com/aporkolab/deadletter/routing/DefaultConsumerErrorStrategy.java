package com.aporkolab.deadletter.routing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import com.aporkolab.deadletter.exception.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Moves every failed message to one shared error queue.
 * 
 * Design decisions:
 * - One direct error exchange per original routing key, all bound to the same error queue
 * - The failed message is wrapped in a JSON {@link ErrorMessage} with full failure context
 * - If the error queue cannot be reached the delivery is requeued, never dropped
 */
public class DefaultConsumerErrorStrategy implements ConsumerErrorStrategy {

    private static final Logger log = LoggerFactory.getLogger(DefaultConsumerErrorStrategy.class);

    public static final String DEFAULT_ERROR_QUEUE = "default_error_queue";
    public static final String DEFAULT_ERROR_EXCHANGE_PREFIX = "ErrorExchange_";
    public static final String ERROR_MESSAGE_TYPE = "ErrorMessage";
    private static final int MAX_STACK_TRACE_LENGTH = 2000;

    private final ConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final String errorQueueName;
    private final String errorExchangePrefix;
    private final String hostname;

    private final Set<String> declaredExchanges = ConcurrentHashMap.newKeySet();

    public DefaultConsumerErrorStrategy(ConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        this(connectionFactory, objectMapper, DEFAULT_ERROR_QUEUE, DEFAULT_ERROR_EXCHANGE_PREFIX);
    }

    public DefaultConsumerErrorStrategy(ConnectionFactory connectionFactory, ObjectMapper objectMapper,
                                        String errorQueueName, String errorExchangePrefix) {
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.errorQueueName = errorQueueName;
        this.errorExchangePrefix = errorExchangePrefix;
        this.hostname = System.getenv().getOrDefault("HOSTNAME", "unknown");
    }

    @Override
    public AckStrategy handleConsumerError(FailureContext context, Throwable exception) {
        try {
            byte[] payload = objectMapper.writeValueAsBytes(buildErrorMessage(context, exception));

            String errorExchange = BrokerChannels.execute(connectionFactory, channel -> {
                String exchange = declareErrorExchange(channel, context.getRoutingKey());
                publish(channel, exchange, context.getRoutingKey(), payload);
                return exchange;
            });

            log.info("Failed message moved to error queue '{}' via exchange '{}': {}",
                    errorQueueName, errorExchange, describe(exception));
            return AckStrategy.ACK;

        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Critical: failed to move message to error queue '{}', requeueing it. Original failure: {}",
                    errorQueueName, describe(exception), e);
            return AckStrategy.NACK_WITH_REQUEUE;
        }
    }

    @Override
    public AckStrategy handleConsumerCancelled(FailureContext context) {
        log.warn("Consumer cancelled while handling delivery {}, requeueing", context.getDeliveryTag());
        return AckStrategy.NACK_WITH_REQUEUE;
    }

    public String getErrorQueueName() {
        return errorQueueName;
    }

    String errorExchangeName(String routingKey) {
        return errorExchangePrefix + routingKey;
    }

    ErrorMessage buildErrorMessage(FailureContext context, Throwable exception) {
        return ErrorMessage.builder()
                .routingKey(context.getRoutingKey())
                .exchange(context.getExchange())
                .queue(context.getQueue())
                .messageType(context.getMessageType())
                .correlationId(context.getCorrelationId())
                .message(new String(context.getBody(), StandardCharsets.UTF_8))
                .exception(describe(exception))
                .stackTrace(getStackTrace(exception))
                .hostname(hostname)
                .failedAt(Instant.now())
                .build();
    }

    private String declareErrorExchange(Channel channel, String routingKey) {
        String exchange = errorExchangeName(routingKey);
        if (declaredExchanges.contains(exchange)) {
            return exchange;
        }

        try {
            channel.queueDeclare(errorQueueName, true, false, false, null);
            channel.exchangeDeclare(exchange, BuiltinExchangeType.DIRECT, true, false, null);
            channel.queueBind(errorQueueName, exchange, routingKey);
        } catch (IOException | ShutdownSignalException e) {
            throw new TransportException("declareErrorTopology", exchange, e);
        }

        declaredExchanges.add(exchange);
        return exchange;
    }

    private void publish(Channel channel, String exchange, String routingKey, byte[] payload) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .type(ERROR_MESSAGE_TYPE)
                .contentType("application/json")
                .deliveryMode(Republisher.PERSISTENT_DELIVERY_MODE)
                .build();
        try {
            channel.basicPublish(exchange, routingKey, properties, payload);
        } catch (IOException | ShutdownSignalException e) {
            throw TransportException.publish(exchange, e);
        }
    }

    private static String describe(Throwable exception) {
        if (exception == null) {
            return "unknown";
        }
        return exception.getClass().getSimpleName() + ": " + exception.getMessage();
    }

    private String getStackTrace(Throwable e) {
        if (e == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement element : e.getStackTrace()) {
            if (sb.length() > MAX_STACK_TRACE_LENGTH) {
                sb.append("...(truncated)");
                break;
            }
            sb.append(element.toString()).append("\n");
        }
        return sb.toString();
    }
}
