package com.aporkolab.deadletter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import com.aporkolab.deadletter.exception.DeadLetterException;
import com.aporkolab.deadletter.routing.DeadLetterMapping;
import com.aporkolab.deadletter.routing.DeadLetterRoutingListener;
import com.aporkolab.deadletter.routing.FailureContext;
import com.aporkolab.deadletter.routing.FallbackReason;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for typed dead letter routing.
 * 
 * Provides the following metrics:
 * - dead_letter_requeued_total: First-delivery failures sent back for one more attempt
 * - dead_letter_routed_total: Messages republished to a typed dead letter queue, by dead letter type
 * - dead_letter_fallback_total: Failures handed to default error handling, by reason
 * - dead_letter_routing_failures_total: Provisioning or publishing failures, by error code
 * - dead_letter_provisioned_total: Destinations declared on the broker, by queue
 * - dead_letter_routing_duration: Time to provision and republish one failed message
 * - dead_letter_provisioned_destinations: Destinations known to this process
 */
public class DeadLetterMetrics implements DeadLetterRoutingListener {

    private static final String METRIC_PREFIX = "dead_letter";
    static final String UNEXPECTED_ERROR_CODE = "UNEXPECTED";

    private final MeterRegistry registry;
    private final Tags baseTags;

    private final Counter requeuedCounter;
    private final Timer routingTimer;
    private final AtomicLong provisionedDestinations = new AtomicLong(0);

    public DeadLetterMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public DeadLetterMetrics(MeterRegistry registry, String consumerName) {
        this(registry, Tags.of("consumer", consumerName));
    }

    public DeadLetterMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.requeuedCounter = Counter.builder(METRIC_PREFIX + "_requeued_total")
                .description("Failed first deliveries requeued for one more attempt")
                .tags(baseTags)
                .register(registry);

        this.routingTimer = Timer.builder(METRIC_PREFIX + "_routing_duration")
                .description("Time to provision the destination and republish a failed message")
                .tags(baseTags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + "_provisioned_destinations", provisionedDestinations, AtomicLong::get)
                .description("Dead letter destinations provisioned by this process")
                .tags(baseTags)
                .register(registry);
    }

    @Override
    public void onRequeued(FailureContext context) {
        requeuedCounter.increment();
    }

    @Override
    public void onRouted(FailureContext context, DeadLetterMapping mapping, Duration elapsed) {
        Counter.builder(METRIC_PREFIX + "_routed_total")
                .tags(baseTags.and("dead_letter_type", mapping.target().typeName()))
                .description("Failed messages republished to a typed dead letter queue")
                .register(registry)
                .increment();
        routingTimer.record(elapsed);
    }

    @Override
    public void onFallback(FailureContext context, FallbackReason reason) {
        Counter.builder(METRIC_PREFIX + "_fallback_total")
                .tags(baseTags.and("reason", reason.name()))
                .description("Failed messages handed to default error handling")
                .register(registry)
                .increment();
    }

    @Override
    public void onRoutingFailed(FailureContext context, Throwable routingError) {
        Counter.builder(METRIC_PREFIX + "_routing_failures_total")
                .tags(baseTags.and("error_code", errorCode(routingError)))
                .description("Dead letter routing attempts that failed")
                .register(registry)
                .increment();
    }

    @Override
    public void onProvisioned(DeadLetterMapping mapping, String queueName, String exchangeName) {
        provisionedDestinations.incrementAndGet();
        Counter.builder(METRIC_PREFIX + "_provisioned_total")
                .tags(baseTags.and("queue", queueName))
                .description("Dead letter destinations declared on the broker")
                .register(registry)
                .increment();
    }

    /**
     * Number of failed messages successfully routed so far, across all dead letter types.
     */
    public long getRoutedCount() {
        return (long) registry.find(METRIC_PREFIX + "_routed_total").counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    /**
     * Share of redelivered failures that reached a typed dead letter queue, as a percentage.
     */
    public double getRoutedRate() {
        double routed = getRoutedCount();
        double fallback = registry.find(METRIC_PREFIX + "_fallback_total").counters().stream()
                .mapToDouble(Counter::count)
                .sum();
        double total = routed + fallback;
        if (total == 0) return 0.0;
        return (routed / total) * 100.0;
    }

    private static String errorCode(Throwable routingError) {
        if (routingError instanceof DeadLetterException deadLetterError) {
            return deadLetterError.getCode();
        }
        return UNEXPECTED_ERROR_CODE;
    }
}
