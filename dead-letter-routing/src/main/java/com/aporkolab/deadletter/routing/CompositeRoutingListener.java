package com.aporkolab.deadletter.routing;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans routing events out to several listeners.
 * 
 * A failing listener is logged and skipped. Routing outcomes are already final when
 * listeners run, so a listener error must never reach the consumer's ack decision.
 */
class CompositeRoutingListener implements DeadLetterRoutingListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeRoutingListener.class);

    private final List<DeadLetterRoutingListener> listeners;

    CompositeRoutingListener(List<DeadLetterRoutingListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void onRequeued(FailureContext context) {
        dispatch("onRequeued", listener -> listener.onRequeued(context));
    }

    @Override
    public void onRouted(FailureContext context, DeadLetterMapping mapping, Duration elapsed) {
        dispatch("onRouted", listener -> listener.onRouted(context, mapping, elapsed));
    }

    @Override
    public void onFallback(FailureContext context, FallbackReason reason) {
        dispatch("onFallback", listener -> listener.onFallback(context, reason));
    }

    @Override
    public void onRoutingFailed(FailureContext context, Throwable routingError) {
        dispatch("onRoutingFailed", listener -> listener.onRoutingFailed(context, routingError));
    }

    @Override
    public void onProvisioned(DeadLetterMapping mapping, String queueName, String exchangeName) {
        dispatch("onProvisioned", listener -> listener.onProvisioned(mapping, queueName, exchangeName));
    }

    List<DeadLetterRoutingListener> listeners() {
        return listeners;
    }

    private void dispatch(String event, Consumer<DeadLetterRoutingListener> callback) {
        for (DeadLetterRoutingListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Dead letter routing listener {} failed on {}: {}",
                        listener.getClass().getName(), event, e.getMessage(), e);
            }
        }
    }
}
