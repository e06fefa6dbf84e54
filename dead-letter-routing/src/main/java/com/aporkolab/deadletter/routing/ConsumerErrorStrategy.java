package com.aporkolab.deadletter.routing;

/**
 * Decides what happens to a delivery whose consumer failed.
 * Implementations must not throw: every failure path ends in an {@link AckStrategy}.
 */
public interface ConsumerErrorStrategy {

    AckStrategy handleConsumerError(FailureContext context, Throwable exception);

    /**
     * Called when the broker cancels the consumer while the delivery was in flight.
     */
    default AckStrategy handleConsumerCancelled(FailureContext context) {
        return AckStrategy.NACK_WITH_REQUEUE;
    }
}
