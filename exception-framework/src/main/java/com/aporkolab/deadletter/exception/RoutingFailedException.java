package com.aporkolab.deadletter.exception;

/**
 * Composite error handed to the fallback strategy when dead-letter routing fails.
 * 
 * The consumer error that triggered routing is the cause; the routing failure is kept
 * in {@link #getRoutingError()} and attached as a suppressed exception, so neither is lost.
 */
public class RoutingFailedException extends DeadLetterException {

    public static final String CODE = "DEAD_LETTER_ROUTING_FAILED";

    private final Throwable routingError;

    public RoutingFailedException(Throwable routingError, Throwable consumerError) {
        super(
            CODE,
            String.format("Dead letter routing failed: %s. Original exception: %s",
                    describe(routingError), describe(consumerError)),
            consumerError
        );
        this.routingError = routingError;
        if (routingError != null && routingError != consumerError) {
            addSuppressed(routingError);
        }
        if (routingError instanceof DeadLetterException deadLetterException) {
            with("routingErrorCode", deadLetterException.getCode());
        }
    }

    public Throwable getRoutingError() {
        return routingError;
    }

    public Throwable getConsumerError() {
        return getCause();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "none";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
