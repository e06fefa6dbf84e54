package com.aporkolab.deadletter.routing;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import com.rabbitmq.client.Channel;

/**
 * Listener for a MANUAL-ack Spring AMQP container that applies a {@link ConsumerErrorStrategy}
 * to every failed delivery.
 * 
 * Usage:
 * <pre>
 * SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
 * container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
 * container.setMessageListener(new DeadLetterRoutingMessageListener(orderHandler, strategy));
 * </pre>
 */
public class DeadLetterRoutingMessageListener implements ChannelAwareMessageListener {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRoutingMessageListener.class);

    private final MessageHandler handler;
    private final ConsumerErrorStrategy errorStrategy;

    public DeadLetterRoutingMessageListener(MessageHandler handler, ConsumerErrorStrategy errorStrategy) {
        this.handler = handler;
        this.errorStrategy = errorStrategy;
    }

    @Override
    public void onMessage(Message message, Channel channel) throws Exception {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();

        try {
            handler.handle(message);
        } catch (Exception e) {
            log.debug("Consumer failed on delivery {}: {}", deliveryTag, e.getMessage());
            AckStrategy ackStrategy = errorStrategy.handleConsumerError(FailureContext.from(message), e);
            apply(channel, deliveryTag, ackStrategy);
            return;
        }

        channel.basicAck(deliveryTag, false);
    }

    private void apply(Channel channel, long deliveryTag, AckStrategy ackStrategy) throws IOException {
        switch (ackStrategy) {
            case ACK -> channel.basicAck(deliveryTag, false);
            case NACK_WITH_REQUEUE -> channel.basicNack(deliveryTag, false, true);
            case NACK_WITHOUT_REQUEUE -> channel.basicNack(deliveryTag, false, false);
        }
    }
}
