package com.aporkolab.deadletter.logging;

import java.util.Map;

import org.slf4j.MDC;

/**
 * MDC scope for one failure-routing invocation.
 * 
 * Every log line written while the scope is open carries the failed message's
 * type, routing key, correlation id and delivery tag. Closing the scope restores
 * whatever MDC map the consumer thread had before.
 * 
 * Usage:
 * <pre>
 * try (var ctx = DeadLetterLogContext.open()
 *         .withMessageType(type)
 *         .withRoutingKey(routingKey)) {
 *     log.info("Routing failed message");
 * }
 * </pre>
 */
public class DeadLetterLogContext implements AutoCloseable {

    public static final String MESSAGE_TYPE_KEY = "messageType";
    public static final String ROUTING_KEY_KEY = "routingKey";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String DELIVERY_TAG_KEY = "deliveryTag";
    public static final String DEAD_LETTER_QUEUE_KEY = "deadLetterQueue";

    private final Map<String, String> previousContext;

    private DeadLetterLogContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    public static DeadLetterLogContext open() {
        return new DeadLetterLogContext(MDC.getCopyOfContextMap());
    }

    public DeadLetterLogContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public DeadLetterLogContext withMessageType(String messageType) {
        return with(MESSAGE_TYPE_KEY, messageType);
    }

    public DeadLetterLogContext withRoutingKey(String routingKey) {
        return with(ROUTING_KEY_KEY, routingKey);
    }

    public DeadLetterLogContext withCorrelationId(String correlationId) {
        return with(CORRELATION_ID_KEY, correlationId);
    }

    public DeadLetterLogContext withDeliveryTag(long deliveryTag) {
        return with(DELIVERY_TAG_KEY, String.valueOf(deliveryTag));
    }

    public DeadLetterLogContext withDeadLetterQueue(String queueName) {
        return with(DEAD_LETTER_QUEUE_KEY, queueName);
    }

    public static String currentMessageType() {
        return MDC.get(MESSAGE_TYPE_KEY);
    }

    @Override
    public void close() {
        if (previousContext != null) {
            MDC.setContextMap(previousContext);
        } else {
            MDC.clear();
        }
    }
}
