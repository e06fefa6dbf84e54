package com.aporkolab.deadletter.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompositeRoutingListenerTest {

    private static final FailureContext CONTEXT = FailureContext.builder().messageType("OrderCreated").build();
    private static final DeadLetterMapping MAPPING = new DeadLetterMapping("OrderCreated",
            DeadLetterTarget.of("OrderCreatedDeadLetter", "Order.Created.DeadLetter", "Order.Created.DeadLetter"));

    @Mock
    private DeadLetterRoutingListener metrics;

    @Mock
    private DeadLetterRoutingListener audit;

    @Test
    @DisplayName("should notify every listener in order")
    void shouldNotifyAllInOrder() {
        DeadLetterRoutingListener composite = DeadLetterRoutingListener.composite(List.of(metrics, audit));

        composite.onRouted(CONTEXT, MAPPING, Duration.ofMillis(3));

        InOrder order = inOrder(metrics, audit);
        order.verify(metrics).onRouted(CONTEXT, MAPPING, Duration.ofMillis(3));
        order.verify(audit).onRouted(CONTEXT, MAPPING, Duration.ofMillis(3));
    }

    @Test
    @DisplayName("should keep notifying after a listener fails")
    void shouldIsolateFailingListener() {
        doThrow(new IllegalStateException("metrics backend down")).when(metrics).onFallback(any(), any());
        DeadLetterRoutingListener composite = DeadLetterRoutingListener.composite(metrics, audit);

        assertThatCode(() -> composite.onFallback(CONTEXT, FallbackReason.UNMAPPED_MESSAGE_TYPE))
                .doesNotThrowAnyException();

        verify(audit).onFallback(CONTEXT, FallbackReason.UNMAPPED_MESSAGE_TYPE);
    }

    @Test
    @DisplayName("should flatten nested composites and skip no-op or missing listeners")
    void shouldFlatten() {
        DeadLetterRoutingListener inner = DeadLetterRoutingListener.composite(metrics, DeadLetterRoutingListener.NOOP);

        DeadLetterRoutingListener outer = DeadLetterRoutingListener.composite(Arrays.asList(inner, null, audit));

        assertThat(((CompositeRoutingListener) outer).listeners()).containsExactly(metrics, audit);
    }

    @Test
    @DisplayName("should do nothing without listeners")
    void shouldAcceptNoListeners() {
        DeadLetterRoutingListener composite = DeadLetterRoutingListener.composite(List.of());

        assertThatCode(() -> composite.onProvisioned(MAPPING, "q", "x")).doesNotThrowAnyException();
    }
}
