package com.aporkolab.deadletter.routing.fixtures;

import com.aporkolab.deadletter.routing.DeadLetter;

/** Dead letter target without naming metadata. */
@DeadLetter(value = PaymentFailedDeadLetter.class, messageType = "payments.failed")
public class PaymentFailed {
}
