package com.aporkolab.deadletter.routing;

/**
 * Outcome of the retry gate for one failed delivery.
 */
public record RoutingDecision(Action action, DeadLetterMapping mapping, FallbackReason reason) {

    public enum Action {
        REQUEUE,
        DEFAULT_ERROR_HANDLING,
        ROUTE_TO_DEAD_LETTER
    }

    public static RoutingDecision requeue() {
        return new RoutingDecision(Action.REQUEUE, null, null);
    }

    public static RoutingDecision fallback(FallbackReason reason) {
        return new RoutingDecision(Action.DEFAULT_ERROR_HANDLING, null, reason);
    }

    public static RoutingDecision route(DeadLetterMapping mapping) {
        return new RoutingDecision(Action.ROUTE_TO_DEAD_LETTER, mapping, null);
    }
}
