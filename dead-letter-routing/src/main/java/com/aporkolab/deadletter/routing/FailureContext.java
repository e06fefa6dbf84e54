package com.aporkolab.deadletter.routing;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

/**
 * Everything known about one failed delivery.
 * Created per failure by the consumer, never persisted.
 */
public class FailureContext {

    private static final byte[] EMPTY_BODY = new byte[0];

    private byte[] body = EMPTY_BODY;
    private String messageType;
    private String correlationId;
    private String routingKey = "";
    private String exchange = "";
    private String queue;
    private String consumerTag;
    private long deliveryTag;
    private boolean redelivered;

    private FailureContext() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build the context from a message received by a Spring AMQP listener container.
     */
    public static FailureContext from(Message message) {
        MessageProperties properties = message.getMessageProperties();
        return builder()
                .body(message.getBody())
                .messageType(properties.getType())
                .correlationId(properties.getCorrelationId())
                .routingKey(properties.getReceivedRoutingKey())
                .exchange(properties.getReceivedExchange())
                .queue(properties.getConsumerQueue())
                .consumerTag(properties.getConsumerTag())
                .deliveryTag(properties.getDeliveryTag())
                .redelivered(Boolean.TRUE.equals(properties.getRedelivered()))
                .build();
    }

    // Getters
    public byte[] getBody() { return body; }
    public String getMessageType() { return messageType; }
    public String getCorrelationId() { return correlationId; }
    public String getRoutingKey() { return routingKey; }
    public String getExchange() { return exchange; }
    public String getQueue() { return queue; }
    public String getConsumerTag() { return consumerTag; }
    public long getDeliveryTag() { return deliveryTag; }
    public boolean isRedelivered() { return redelivered; }

    @Override
    public String toString() {
        return "FailureContext{messageType=" + messageType
                + ", routingKey=" + routingKey
                + ", exchange=" + exchange
                + ", queue=" + queue
                + ", deliveryTag=" + deliveryTag
                + ", redelivered=" + redelivered
                + ", bodyLength=" + body.length + "}";
    }

    public static class Builder {
        private final FailureContext context = new FailureContext();

        public Builder body(byte[] body) {
            context.body = body != null ? body : EMPTY_BODY;
            return this;
        }

        public Builder messageType(String messageType) {
            context.messageType = messageType;
            return this;
        }

        public Builder correlationId(String correlationId) {
            context.correlationId = correlationId;
            return this;
        }

        public Builder routingKey(String routingKey) {
            context.routingKey = routingKey != null ? routingKey : "";
            return this;
        }

        public Builder exchange(String exchange) {
            context.exchange = exchange != null ? exchange : "";
            return this;
        }

        public Builder queue(String queue) {
            context.queue = queue;
            return this;
        }

        public Builder consumerTag(String consumerTag) {
            context.consumerTag = consumerTag;
            return this;
        }

        public Builder deliveryTag(long deliveryTag) {
            context.deliveryTag = deliveryTag;
            return this;
        }

        public Builder redelivered(boolean redelivered) {
            context.redelivered = redelivered;
            return this;
        }

        public FailureContext build() {
            return context;
        }
    }
}
