package com.aporkolab.deadletter.routing;

import com.aporkolab.deadletter.exception.ConfigurationException;

/**
 * Queue name is {@code "{queueName}_{typeName}"}, exchange name is used as declared.
 */
public class TypeSuffixedNamingConvention implements QueueNamingConvention {

    private static final String SEPARATOR = "_";

    @Override
    public String queueName(DeadLetterTarget target) {
        if (target.queueName() == null || target.queueName().isBlank()) {
            throw ConfigurationException.missingQueueName(target.typeName());
        }
        return target.queueName() + SEPARATOR + target.typeName();
    }

    @Override
    public String exchangeName(DeadLetterTarget target) {
        if (target.exchangeName() == null || target.exchangeName().isBlank()) {
            throw ConfigurationException.missingExchangeName(target.typeName());
        }
        return target.exchangeName();
    }
}
