package com.aporkolab.deadletter.routing;

/**
 * Why a redelivered failure went to the default error handling instead of a typed dead letter queue.
 */
public enum FallbackReason {

    /** The message carried no type property */
    MISSING_MESSAGE_TYPE,

    /** The message type has no dead letter mapping */
    UNMAPPED_MESSAGE_TYPE,

    /** A mapping existed but provisioning or publishing failed */
    ROUTING_FAILED
}
