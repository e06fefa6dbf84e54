package com.aporkolab.deadletter.exception;

/**
 * A declared dead-letter mapping cannot be resolved to a destination.
 * 
 * Raised per message when the target dead-letter type lacks its naming metadata.
 */
public class ConfigurationException extends DeadLetterException {

    public static final String CODE = "DEAD_LETTER_CONFIGURATION_ERROR";

    public ConfigurationException(String message) {
        super(CODE, message);
    }

    public static ConfigurationException missingQueueName(String deadLetterType) {
        ConfigurationException exception = new ConfigurationException(String.format(
                "Dead letter type '%s' does not declare a queue name", deadLetterType));
        exception.with("deadLetterType", deadLetterType);
        exception.with("missing", "queueName");
        return exception;
    }

    public static ConfigurationException missingExchangeName(String deadLetterType) {
        ConfigurationException exception = new ConfigurationException(String.format(
                "Dead letter type '%s' does not declare an exchange name", deadLetterType));
        exception.with("deadLetterType", deadLetterType);
        exception.with("missing", "exchangeName");
        return exception;
    }
}
