package com.aporkolab.deadletter.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import com.rabbitmq.client.Channel;

@ExtendWith(MockitoExtension.class)
class DeadLetterRoutingMessageListenerTest {

    private static final long DELIVERY_TAG = 42L;

    @Mock
    private Channel channel;

    @Mock
    private ConsumerErrorStrategy errorStrategy;

    @Test
    @DisplayName("should ack a successfully handled delivery")
    void shouldAckOnSuccess() throws Exception {
        DeadLetterRoutingMessageListener listener = new DeadLetterRoutingMessageListener(message -> { }, errorStrategy);

        listener.onMessage(message(), channel);

        verify(channel).basicAck(DELIVERY_TAG, false);
        verifyNoInteractions(errorStrategy);
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
            "ACK, true, false",
            "NACK_WITH_REQUEUE, false, true",
            "NACK_WITHOUT_REQUEUE, false, false"
    })
    @DisplayName("should apply the strategy's decision to the channel")
    void shouldApplyDecision(AckStrategy decision, boolean acked, boolean requeued) throws Exception {
        when(errorStrategy.handleConsumerError(any(), any())).thenReturn(decision);
        DeadLetterRoutingMessageListener listener = new DeadLetterRoutingMessageListener(message -> {
            throw new IllegalStateException("handler failed");
        }, errorStrategy);

        listener.onMessage(message(), channel);

        if (acked) {
            verify(channel).basicAck(DELIVERY_TAG, false);
        } else {
            verify(channel).basicNack(DELIVERY_TAG, false, requeued);
        }
    }

    @Test
    @DisplayName("should pass delivery metadata and the handler's exception to the strategy")
    void shouldPassFailureContext() throws Exception {
        when(errorStrategy.handleConsumerError(any(), any())).thenReturn(AckStrategy.ACK);
        Exception failure = new Exception("checked failure");
        DeadLetterRoutingMessageListener listener = new DeadLetterRoutingMessageListener(message -> {
            throw failure;
        }, errorStrategy);

        listener.onMessage(message(), channel);

        ArgumentCaptor<FailureContext> context = ArgumentCaptor.forClass(FailureContext.class);
        verify(errorStrategy).handleConsumerError(context.capture(), eq(failure));
        assertThat(context.getValue().getMessageType()).isEqualTo("OrderCreated");
        assertThat(context.getValue().getRoutingKey()).isEqualTo("orders.created");
        assertThat(context.getValue().getExchange()).isEqualTo("orders");
        assertThat(context.getValue().getQueue()).isEqualTo("orders.inventory");
        assertThat(context.getValue().getCorrelationId()).isEqualTo("corr-9");
        assertThat(context.getValue().getDeliveryTag()).isEqualTo(DELIVERY_TAG);
        assertThat(context.getValue().isRedelivered()).isTrue();
        assertThat(new String(context.getValue().getBody(), StandardCharsets.UTF_8)).isEqualTo("payload");
    }

    @Test
    @DisplayName("should treat a missing redelivered flag as a first delivery")
    void shouldTreatMissingRedeliveredFlagAsFirstDelivery() {
        MessageProperties properties = new MessageProperties();
        properties.setRedelivered(null);

        FailureContext context = FailureContext.from(new Message(new byte[0], properties));

        assertThat(context.isRedelivered()).isFalse();
        assertThat(context.getRoutingKey()).isEmpty();
        assertThat(context.getMessageType()).isNull();
    }

    private Message message() {
        MessageProperties properties = new MessageProperties();
        properties.setType("OrderCreated");
        properties.setReceivedRoutingKey("orders.created");
        properties.setReceivedExchange("orders");
        properties.setConsumerQueue("orders.inventory");
        properties.setCorrelationId("corr-9");
        properties.setDeliveryTag(DELIVERY_TAG);
        properties.setRedelivered(true);
        return new Message("payload".getBytes(StandardCharsets.UTF_8), properties);
    }
}
