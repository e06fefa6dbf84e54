package com.aporkolab.deadletter.routing;

import java.time.Instant;

/**
 * Envelope published to the default error queue.
 * Contains all context needed for debugging and manual reprocessing.
 */
public class ErrorMessage {

    private String routingKey;
    private String exchange;
    private String queue;
    private String messageType;
    private String correlationId;
    private String message;
    private String exception;
    private String stackTrace;
    private String hostname;
    private Instant failedAt;

    private ErrorMessage() {}

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public String getRoutingKey() { return routingKey; }
    public String getExchange() { return exchange; }
    public String getQueue() { return queue; }
    public String getMessageType() { return messageType; }
    public String getCorrelationId() { return correlationId; }
    public String getMessage() { return message; }
    public String getException() { return exception; }
    public String getStackTrace() { return stackTrace; }
    public String getHostname() { return hostname; }
    public Instant getFailedAt() { return failedAt; }

    public static class Builder {
        private final ErrorMessage errorMessage = new ErrorMessage();

        public Builder routingKey(String routingKey) {
            errorMessage.routingKey = routingKey;
            return this;
        }

        public Builder exchange(String exchange) {
            errorMessage.exchange = exchange;
            return this;
        }

        public Builder queue(String queue) {
            errorMessage.queue = queue;
            return this;
        }

        public Builder messageType(String messageType) {
            errorMessage.messageType = messageType;
            return this;
        }

        public Builder correlationId(String correlationId) {
            errorMessage.correlationId = correlationId;
            return this;
        }

        public Builder message(String message) {
            errorMessage.message = message;
            return this;
        }

        public Builder exception(String exception) {
            errorMessage.exception = exception;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            errorMessage.stackTrace = stackTrace;
            return this;
        }

        public Builder hostname(String hostname) {
            errorMessage.hostname = hostname;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            errorMessage.failedAt = failedAt;
            return this;
        }

        public ErrorMessage build() {
            return errorMessage;
        }
    }
}
