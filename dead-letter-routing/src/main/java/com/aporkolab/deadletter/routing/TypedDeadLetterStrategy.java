package com.aporkolab.deadletter.routing;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import com.aporkolab.deadletter.exception.ConfigurationException;
import com.aporkolab.deadletter.exception.RoutingFailedException;
import com.aporkolab.deadletter.exception.TransportException;
import com.aporkolab.deadletter.logging.DeadLetterLogContext;

/**
 * Routes each failed message to the dead letter queue declared for its own type.
 * 
 * Flow per failure:
 * 1. First delivery: requeue once, nothing else
 * 2. Redelivery of a mapped type: provision the destination, republish, ack the original
 * 3. Redelivery of an unmapped or untyped message: default error handling
 * 
 * Routing never loses a message. Any failure while provisioning or publishing is
 * wrapped together with the consumer's error and handed to the fallback strategy.
 */
public class TypedDeadLetterStrategy implements ConsumerErrorStrategy {

    private static final Logger log = LoggerFactory.getLogger(TypedDeadLetterStrategy.class);

    private final ConnectionFactory connectionFactory;
    private final RetryGate retryGate;
    private final TopologyProvisioner provisioner;
    private final Republisher republisher;
    private final ConsumerErrorStrategy fallback;
    private final DeadLetterRoutingListener listener;

    public TypedDeadLetterStrategy(ConnectionFactory connectionFactory,
                                   RetryGate retryGate,
                                   TopologyProvisioner provisioner,
                                   Republisher republisher,
                                   ConsumerErrorStrategy fallback) {
        this(connectionFactory, retryGate, provisioner, republisher, fallback, DeadLetterRoutingListener.NOOP);
    }

    public TypedDeadLetterStrategy(ConnectionFactory connectionFactory,
                                   RetryGate retryGate,
                                   TopologyProvisioner provisioner,
                                   Republisher republisher,
                                   ConsumerErrorStrategy fallback,
                                   DeadLetterRoutingListener listener) {
        this.connectionFactory = connectionFactory;
        this.retryGate = retryGate;
        this.provisioner = provisioner;
        this.republisher = republisher;
        this.fallback = fallback;
        this.listener = DeadLetterRoutingListener.composite(listener);
    }

    @Override
    public AckStrategy handleConsumerError(FailureContext context, Throwable exception) {
        try (var logContext = DeadLetterLogContext.open()
                .withMessageType(context.getMessageType())
                .withRoutingKey(context.getRoutingKey())
                .withCorrelationId(context.getCorrelationId())
                .withDeliveryTag(context.getDeliveryTag())) {

            RoutingDecision decision;
            try {
                decision = retryGate.decide(context);
            } catch (RuntimeException routingError) {
                return fallbackAfterRoutingFailure(context, exception, routingError);
            }

            if (decision.action() != RoutingDecision.Action.ROUTE_TO_DEAD_LETTER) {
                return handleUnrouted(context, exception, decision);
            }

            Duration elapsed;
            try {
                long start = System.nanoTime();
                routeToDeadLetter(context, decision.mapping(), logContext);
                elapsed = Duration.ofNanos(System.nanoTime() - start);
            } catch (RuntimeException routingError) {
                return fallbackAfterRoutingFailure(context, exception, routingError);
            }

            log.info("Failed message routed to dead letter type '{}' after redelivery: {}",
                    decision.mapping().target().typeName(), describe(exception));
            listener.onRouted(context, decision.mapping(), elapsed);
            return AckStrategy.ACK;
        }
    }

    @Override
    public AckStrategy handleConsumerCancelled(FailureContext context) {
        return fallback.handleConsumerCancelled(context);
    }

    private AckStrategy handleUnrouted(FailureContext context, Throwable exception, RoutingDecision decision) {
        if (decision.action() == RoutingDecision.Action.REQUEUE) {
            log.debug("First delivery failed, requeueing for one more attempt: {}", describe(exception));
            listener.onRequeued(context);
            return AckStrategy.NACK_WITH_REQUEUE;
        }

        log.debug("No dead letter route ({}), using default error handling", decision.reason());
        listener.onFallback(context, decision.reason());
        return fallback.handleConsumerError(context, exception);
    }

    private void routeToDeadLetter(FailureContext context, DeadLetterMapping mapping,
                                   DeadLetterLogContext logContext) {
        BrokerChannels.execute(connectionFactory, channel -> {
            String exchange = provisioner.ensure(channel, mapping);
            logContext.withDeadLetterQueue(provisioner.queueName(mapping));
            republisher.publish(channel, exchange, context.getRoutingKey(), mapping.target().typeName(),
                    context.getCorrelationId(), context.getBody());
            return exchange;
        });
    }

    private AckStrategy fallbackAfterRoutingFailure(FailureContext context, Throwable exception,
                                                    RuntimeException routingError) {
        if (routingError instanceof ConfigurationException configurationError) {
            log.error("Dead letter configuration error [{}]: {}",
                    configurationError.getCode(), configurationError.getMessage());
        } else if (routingError instanceof TransportException transportError) {
            log.warn("Dead letter routing failed on the broker [{}]: {}",
                    transportError.getCode(), transportError.getMessage());
        } else {
            log.error("Unexpected dead letter routing failure", routingError);
        }

        listener.onRoutingFailed(context, routingError);
        listener.onFallback(context, FallbackReason.ROUTING_FAILED);
        return fallback.handleConsumerError(context, new RoutingFailedException(routingError, exception));
    }

    private static String describe(Throwable exception) {
        if (exception == null) {
            return "unknown";
        }
        return exception.getClass().getSimpleName() + ": " + exception.getMessage();
    }
}
