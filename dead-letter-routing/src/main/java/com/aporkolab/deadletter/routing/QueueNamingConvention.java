package com.aporkolab.deadletter.routing;

/**
 * Derives broker destination names from a dead letter type descriptor.
 */
public interface QueueNamingConvention {

    String queueName(DeadLetterTarget target);

    String exchangeName(DeadLetterTarget target);

    static QueueNamingConvention typeSuffixed() {
        return new TypeSuffixedNamingConvention();
    }
}
