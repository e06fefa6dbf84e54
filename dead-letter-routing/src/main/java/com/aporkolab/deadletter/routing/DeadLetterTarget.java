package com.aporkolab.deadletter.routing;

import java.util.Objects;

/**
 * Descriptor of a dead letter message type.
 * 
 * {@code queueName} and {@code exchangeName} are null when the type declares no naming
 * metadata; that is reported as a configuration error when the destination is provisioned.
 */
public record DeadLetterTarget(String typeName, String queueName, String exchangeName) {

    public DeadLetterTarget {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("typeName must not be null or blank");
        }
    }

    public static DeadLetterTarget of(String typeName, String queueName, String exchangeName) {
        return new DeadLetterTarget(typeName, queueName, exchangeName);
    }

    /**
     * Reads {@link DeadLetterQueue} from the given dead letter type.
     */
    public static DeadLetterTarget of(Class<?> deadLetterType) {
        Objects.requireNonNull(deadLetterType, "deadLetterType must not be null");
        DeadLetterQueue naming = deadLetterType.getAnnotation(DeadLetterQueue.class);
        if (naming == null) {
            return new DeadLetterTarget(deadLetterType.getSimpleName(), null, null);
        }
        return new DeadLetterTarget(deadLetterType.getSimpleName(), naming.queueName(), naming.exchangeName());
    }

    public boolean hasNamingMetadata() {
        return queueName != null && !queueName.isBlank()
                && exchangeName != null && !exchangeName.isBlank();
    }
}
