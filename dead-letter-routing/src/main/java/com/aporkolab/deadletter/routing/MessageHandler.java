package com.aporkolab.deadletter.routing;

import org.springframework.amqp.core.Message;

/**
 * Application processing of one delivery. Throwing marks the delivery as failed.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Message message) throws Exception;
}
