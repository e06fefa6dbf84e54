package com.aporkolab.deadletter.routing;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the queue and exchange of a dead letter type.
 * The provisioned queue is {@code queueName + "_" + simpleClassName}.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface DeadLetterQueue {

    String queueName();

    String exchangeName();
}
