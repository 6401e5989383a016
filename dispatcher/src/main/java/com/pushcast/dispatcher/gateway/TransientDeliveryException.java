package com.pushcast.dispatcher.gateway;

/** Timeout, rate limit, gateway 5xx or network error. Worth retrying. */
public class TransientDeliveryException extends DeliveryException {

    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
