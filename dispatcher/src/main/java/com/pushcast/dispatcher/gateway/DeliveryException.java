package com.pushcast.dispatcher.gateway;

import com.pushcast.dispatcher.DispatchException;

/**
 * A push gateway rejected or failed a send. {@link #isRetryable()} decides
 * whether the scheduler may try the job again.
 */
public abstract class DeliveryException extends DispatchException {

    protected DeliveryException(String message) {
        super(message);
    }

    protected DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
