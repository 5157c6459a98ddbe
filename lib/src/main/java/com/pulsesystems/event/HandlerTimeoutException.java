package com.pulsesystems.event;

import com.pulsesystems.KernelException;

import java.time.Duration;

/**
 * A handler run by {@link PooledEventDrainer} did not finish within its time budget.
 */
public class HandlerTimeoutException extends KernelException {

    public HandlerTimeoutException(String handlerId, Duration timeout) {
        super("Handler " + handlerId + " did not complete within " + timeout.toMillis() + "ms", handlerId);
    }
}
