package com.aporkolab.deadletter.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.aporkolab.deadletter.metrics.DeadLetterMetrics;
import com.aporkolab.deadletter.routing.DeadLetter;
import com.aporkolab.deadletter.routing.DeadLetterQueue;
import com.aporkolab.deadletter.routing.DeadLetterRegistry;
import com.aporkolab.deadletter.routing.DeadLetterRoutingMessageListener;
import com.aporkolab.deadletter.routing.DeadLetterTarget;
import com.aporkolab.deadletter.routing.DefaultConsumerErrorStrategy;
import com.aporkolab.deadletter.routing.MessageHandler;
import com.aporkolab.deadletter.routing.QueueNamingConvention;
import com.aporkolab.deadletter.routing.Republisher;
import com.aporkolab.deadletter.routing.RetryGate;
import com.aporkolab.deadletter.routing.TopologyProvisioner;
import com.aporkolab.deadletter.routing.TypedDeadLetterStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Integration tests for typed dead letter routing against a real RabbitMQ broker.
 * 
 * Tests the complete flow:
 * 1. Consumer fails on first delivery, message is requeued
 * 2. Consumer fails again on redelivery
 * 3. Message lands in its typed dead letter queue, or in the shared error queue
 */
@Testcontainers(disabledWithoutDocker = true)
class TypedDeadLetterIntegrationTest {

    private static final String EXCHANGE = "orders";
    private static final String QUEUE = "orders.inventory";
    private static final String ERROR_QUEUE = "inventory_error_queue";
    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    @Container
    static RabbitMQContainer rabbit = new RabbitMQContainer(
            DockerImageName.parse("rabbitmq:3.12-management-alpine"));

    private static CachingConnectionFactory connectionFactory;
    private static RabbitTemplate rabbitTemplate;
    private static RabbitAdmin admin;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger attempts = new AtomicInteger();

    private SimpleMeterRegistry meterRegistry;
    private DeadLetterMetrics metrics;
    private SimpleMessageListenerContainer listenerContainer;

    @DeadLetter(OrderCreatedDeadLetter.class)
    static class OrderCreated {
    }

    @DeadLetterQueue(queueName = "Order.Created.DeadLetter", exchangeName = "Order.Created.DeadLetter")
    static class OrderCreatedDeadLetter {
    }

    @BeforeAll
    static void setupInfrastructure() {
        connectionFactory = new CachingConnectionFactory(rabbit.getHost(), rabbit.getAmqpPort());
        connectionFactory.setUsername(rabbit.getAdminUsername());
        connectionFactory.setPassword(rabbit.getAdminPassword());

        rabbitTemplate = new RabbitTemplate(connectionFactory);
        admin = new RabbitAdmin(connectionFactory);

        TopicExchange exchange = new TopicExchange(EXCHANGE, true, false);
        Queue queue = new Queue(QUEUE, true, false, false);
        admin.declareExchange(exchange);
        admin.declareQueue(queue);
        admin.declareBinding(BindingBuilder.bind(queue).to(exchange).with("orders.#"));
    }

    @AfterAll
    static void teardown() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    @BeforeEach
    void setUp() {
        admin.purgeQueue(QUEUE, false);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new DeadLetterMetrics(meterRegistry);

        DeadLetterRegistry registry = DeadLetterRegistry.builder()
                .register(OrderCreated.class)
                .register("PaymentFailed", DeadLetterTarget.of("PaymentFailedDeadLetter", null, null))
                .build();

        TypedDeadLetterStrategy strategy = new TypedDeadLetterStrategy(connectionFactory,
                new RetryGate(registry),
                new TopologyProvisioner(QueueNamingConvention.typeSuffixed(), metrics),
                new Republisher(),
                new DefaultConsumerErrorStrategy(connectionFactory, objectMapper, ERROR_QUEUE,
                        DefaultConsumerErrorStrategy.DEFAULT_ERROR_EXCHANGE_PREFIX),
                metrics);

        MessageHandler alwaysFailing = message -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("inventory service unavailable");
        };

        listenerContainer = new SimpleMessageListenerContainer(connectionFactory);
        listenerContainer.setQueueNames(QUEUE);
        listenerContainer.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        listenerContainer.setMessageListener(new DeadLetterRoutingMessageListener(alwaysFailing, strategy));
        listenerContainer.start();
    }

    @AfterEach
    void stopListener() {
        listenerContainer.stop();
    }

    @Test
    @DisplayName("should route a twice-failed message to its typed dead letter queue")
    void shouldRouteToTypedDeadLetterQueue() {
        String body = "{\"orderId\":\"o-1\"}";
        publish("orders.created", "OrderCreated", body);

        Message deadLetter = receive("Order.Created.DeadLetter_OrderCreatedDeadLetter");

        assertThat(new String(deadLetter.getBody(), StandardCharsets.UTF_8)).isEqualTo(body);
        assertThat(deadLetter.getMessageProperties().getType()).isEqualTo("OrderCreatedDeadLetter");
        assertThat(deadLetter.getMessageProperties().getReceivedExchange()).isEqualTo("Order.Created.DeadLetter");
        assertThat(deadLetter.getMessageProperties().getReceivedRoutingKey()).isEqualTo("orders.created");
        assertThat(attempts.get()).isEqualTo(2);

        await().atMost(TIMEOUT).untilAsserted(() ->
                assertThat(admin.getQueueInfo(QUEUE).getMessageCount()).isZero());
        assertThat(meterRegistry.get("dead_letter_requeued_total").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRoutedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should send unmapped types to the shared error queue")
    void shouldSendUnmappedTypesToErrorQueue() throws Exception {
        publish("orders.cancelled", "OrderCancelled", "{\"orderId\":\"o-2\"}");

        JsonNode error = objectMapper.readTree(receive(ERROR_QUEUE).getBody());

        assertThat(error.get("messageType").asText()).isEqualTo("OrderCancelled");
        assertThat(error.get("routingKey").asText()).isEqualTo("orders.cancelled");
        assertThat(error.get("message").asText()).isEqualTo("{\"orderId\":\"o-2\"}");
        assertThat(error.get("exception").asText()).contains("inventory service unavailable");
    }

    @Test
    @DisplayName("should report both errors when the dead letter type is misconfigured")
    void shouldFallBackOnMisconfiguredType() throws Exception {
        publish("orders.payment", "PaymentFailed", "{\"orderId\":\"o-3\"}");

        JsonNode error = objectMapper.readTree(receive(ERROR_QUEUE).getBody());

        assertThat(error.get("messageType").asText()).isEqualTo("PaymentFailed");
        assertThat(error.get("exception").asText())
                .contains("Dead letter routing failed")
                .contains("PaymentFailedDeadLetter")
                .contains("inventory service unavailable");
    }

    private void publish(String routingKey, String type, String body) {
        MessageProperties properties = new MessageProperties();
        properties.setType(type);
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        rabbitTemplate.send(EXCHANGE, routingKey, new Message(body.getBytes(StandardCharsets.UTF_8), properties));
    }

    private Message receive(String queue) {
        Message[] received = new Message[1];
        // the queue only exists once the strategy has declared it
        await().atMost(TIMEOUT).ignoreExceptions().until(() -> {
            received[0] = rabbitTemplate.receive(queue);
            return received[0] != null;
        });
        return received[0];
    }
}
