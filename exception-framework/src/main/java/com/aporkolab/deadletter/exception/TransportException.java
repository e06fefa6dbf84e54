package com.aporkolab.deadletter.exception;

/**
 * Broker communication failures: connection, channel, declare or publish.
 */
public class TransportException extends DeadLetterException {

    public static final String CODE = "BROKER_TRANSPORT_ERROR";

    public TransportException(String operation, String resource, Throwable cause) {
        super(
            CODE,
            String.format("Broker operation '%s' failed for '%s': %s", operation, resource, describe(cause)),
            cause
        );
        with("operation", operation);
        with("resource", resource);
    }

    public static TransportException connection(Throwable cause) {
        return new TransportException("connect", "broker", cause);
    }

    public static TransportException declareExchange(String exchange, Throwable cause) {
        return new TransportException("exchangeDeclare", exchange, cause);
    }

    public static TransportException declareQueue(String queue, Throwable cause) {
        return new TransportException("queueDeclare", queue, cause);
    }

    public static TransportException bindQueue(String queue, Throwable cause) {
        return new TransportException("queueBind", queue, cause);
    }

    public static TransportException publish(String exchange, Throwable cause) {
        return new TransportException("basicPublish", exchange, cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
