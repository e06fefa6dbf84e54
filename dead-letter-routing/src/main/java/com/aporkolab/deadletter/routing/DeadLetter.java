package com.aporkolab.deadletter.routing;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the dead letter type that failed messages of the annotated type are routed to.
 * 
 * The target type must carry {@link DeadLetterQueue} so a destination name can be derived.
 * <pre>
 * &#64;DeadLetter(OrderCreatedDeadLetter.class)
 * public class OrderCreated { ... }
 * </pre>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface DeadLetter {

    /**
     * The dead letter message type.
     */
    Class<?> value();

    /**
     * Message type id as carried in the AMQP {@code type} property.
     * Defaults to the simple name of the annotated class.
     */
    String messageType() default "";
}
