package com.pushcast.dispatcher.trigger;

import com.pushcast.dispatcher.DispatchException;

/** Malformed trigger definition, always raised at creation time. */
public class InvalidTriggerException extends DispatchException {

    public InvalidTriggerException(String message) {
        super(message);
    }

    public InvalidTriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
