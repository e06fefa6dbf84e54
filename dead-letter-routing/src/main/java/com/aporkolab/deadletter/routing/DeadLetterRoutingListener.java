package com.aporkolab.deadletter.routing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Observes routing outcomes, e.g. for metrics. Implementations must be thread-safe and cheap.
 */
public interface DeadLetterRoutingListener {

    DeadLetterRoutingListener NOOP = new DeadLetterRoutingListener() {};

    default void onRequeued(FailureContext context) {}

    default void onRouted(FailureContext context, DeadLetterMapping mapping, Duration elapsed) {}

    default void onFallback(FailureContext context, FallbackReason reason) {}

    default void onRoutingFailed(FailureContext context, Throwable routingError) {}

    default void onProvisioned(DeadLetterMapping mapping, String queueName, String exchangeName) {}

    /**
     * Combine listeners into one that notifies each in order.
     * An exception thrown by one listener is logged and does not stop the others.
     */
    static DeadLetterRoutingListener composite(Collection<? extends DeadLetterRoutingListener> listeners) {
        List<DeadLetterRoutingListener> flattened = new ArrayList<>();
        for (DeadLetterRoutingListener listener : listeners) {
            if (listener == null || listener == NOOP) {
                continue;
            }
            if (listener instanceof CompositeRoutingListener composite) {
                flattened.addAll(composite.listeners());
            } else {
                flattened.add(listener);
            }
        }
        return new CompositeRoutingListener(flattened);
    }

    static DeadLetterRoutingListener composite(DeadLetterRoutingListener... listeners) {
        return composite(Arrays.asList(listeners));
    }
}
