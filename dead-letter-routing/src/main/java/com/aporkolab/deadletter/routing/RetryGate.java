package com.aporkolab.deadletter.routing;

/**
 * Classifies a failed delivery.
 * 
 * A first delivery is requeued once so transient failures get another chance.
 * Only a failure on redelivery is treated as a poison message and looked up in the registry.
 * Redelivery status comes from the broker's delivery metadata; nothing is tracked here.
 */
public class RetryGate {

    private final DeadLetterRegistry registry;

    public RetryGate(DeadLetterRegistry registry) {
        this.registry = registry;
    }

    public RoutingDecision decide(FailureContext context) {
        if (!context.isRedelivered()) {
            return RoutingDecision.requeue();
        }

        String messageType = context.getMessageType();
        if (messageType == null || messageType.isBlank()) {
            return RoutingDecision.fallback(FallbackReason.MISSING_MESSAGE_TYPE);
        }

        return registry.find(messageType)
                .map(RoutingDecision::route)
                .orElseGet(() -> RoutingDecision.fallback(FallbackReason.UNMAPPED_MESSAGE_TYPE));
    }
}
