package com.aporkolab.deadletter.routing;

/**
 * Associates a message type id with the dead letter type its failures are routed to.
 */
public record DeadLetterMapping(String messageType, DeadLetterTarget target) {

    public DeadLetterMapping {
        if (messageType == null || messageType.isBlank()) {
            throw new IllegalArgumentException("messageType must not be null or blank");
        }
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
    }
}
