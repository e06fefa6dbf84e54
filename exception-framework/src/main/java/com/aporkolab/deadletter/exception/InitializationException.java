package com.aporkolab.deadletter.exception;

/**
 * The dead-letter registry could not be built.
 * 
 * Fatal: raised at startup and never recovered. The registry is left empty so the
 * process cannot run with a partially populated mapping.
 */
public class InitializationException extends DeadLetterException {

    public static final String CODE = "REGISTRY_INITIALIZATION_ERROR";

    public InitializationException(String message) {
        super(CODE, message);
    }

    public InitializationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static InitializationException duplicateMessageType(String messageType) {
        InitializationException exception = new InitializationException(
                String.format("Message type '%s' already has a dead letter mapping", messageType));
        exception.with("messageType", messageType);
        return exception;
    }

    public static InitializationException invalidMapping(String messageType, Throwable cause) {
        InitializationException exception = new InitializationException(
                String.format("Invalid dead letter mapping for message type '%s': %s", messageType, cause.getMessage()),
                cause);
        exception.with("messageType", messageType);
        return exception;
    }

    public static InitializationException introspectionFailed(String typeName, Throwable cause) {
        InitializationException exception = new InitializationException(
                String.format("Failed to read dead letter metadata of type '%s': %s", typeName, cause.getMessage()),
                cause);
        exception.with("type", typeName);
        return exception;
    }
}
