package com.aporkolab.deadletter.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aporkolab.deadletter.exception.TransportException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

@ExtendWith(MockitoExtension.class)
class RepublisherTest {

    @Mock
    private Channel channel;

    private final Republisher republisher = new Republisher();

    @Test
    @DisplayName("should publish the body verbatim with dead letter type and persistence")
    void shouldPublishVerbatim() throws Exception {
        byte[] body = "{\"orderId\":42}".getBytes(StandardCharsets.UTF_8);

        republisher.publish(channel, "Order.Created.DeadLetter", "orders.created", "OrderCreatedDeadLetter", "corr-7", body);

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> published = ArgumentCaptor.forClass(byte[].class);
        verify(channel).basicPublish(eq("Order.Created.DeadLetter"), eq("orders.created"),
                properties.capture(), published.capture());

        assertThat(published.getValue()).isSameAs(body);
        assertThat(properties.getValue().getType()).isEqualTo("OrderCreatedDeadLetter");
        assertThat(properties.getValue().getDeliveryMode()).isEqualTo(2);
        assertThat(properties.getValue().getCorrelationId()).isEqualTo("corr-7");
    }

    @Test
    @DisplayName("should leave correlation id unset when the original had none")
    void shouldOmitCorrelationId() {
        assertThat(republisher.properties("OrderCreatedDeadLetter", null).getCorrelationId()).isNull();
    }

    @Test
    @DisplayName("should wrap publish failures as transport errors")
    void shouldWrapPublishFailures() throws Exception {
        doThrow(new IOException("connection reset"))
                .when(channel).basicPublish(any(), any(), any(AMQP.BasicProperties.class), any(byte[].class));

        assertThatThrownBy(() -> republisher.publish(channel, "x", "k", "T", new byte[0]))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("basicPublish")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("should wrap closed channel failures as transport errors")
    void shouldWrapClosedChannel() throws Exception {
        ShutdownSignalException shutdown = new ShutdownSignalException(false, false, null, channel);
        doThrow(new AlreadyClosedException(shutdown))
                .when(channel).basicPublish(any(), any(), any(AMQP.BasicProperties.class), any(byte[].class));

        assertThatThrownBy(() -> republisher.publish(channel, "x", "k", "T", new byte[0]))
                .isInstanceOf(TransportException.class);
    }
}
