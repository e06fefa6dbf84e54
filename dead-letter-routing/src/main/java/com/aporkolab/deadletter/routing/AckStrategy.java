package com.aporkolab.deadletter.routing;

/**
 * What the consumer does with the original delivery after a failure was handled.
 */
public enum AckStrategy {

    /** Consume the delivery; it has been moved elsewhere */
    ACK,

    /** Return the delivery to its queue for another attempt */
    NACK_WITH_REQUEUE,

    /** Reject the delivery without requeueing */
    NACK_WITHOUT_REQUEUE
}
