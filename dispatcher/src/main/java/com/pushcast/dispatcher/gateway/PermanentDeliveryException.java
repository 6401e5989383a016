package com.pushcast.dispatcher.gateway;

/**
 * The gateway refused the message for good: bad request, sender mismatch,
 * or a token that is no longer registered.
 */
public class PermanentDeliveryException extends DeliveryException {

    public static final String UNREGISTERED = "UNREGISTERED";

    private final String errorCode;

    public PermanentDeliveryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /** Gateway error code, e.g. UNREGISTERED or INVALID_ARGUMENT. May be null. */
    public String getErrorCode() {
        return errorCode;
    }

    public boolean isUnregistered() {
        return UNREGISTERED.equals(errorCode);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
