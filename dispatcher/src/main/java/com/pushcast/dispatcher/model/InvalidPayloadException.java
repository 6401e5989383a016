package com.pushcast.dispatcher.model;

import com.pushcast.dispatcher.DispatchException;

/**
 * Malformed target selector or message content. Rejected when the request is
 * made; if a stored payload turns out to be unreadable at fire time the job is
 * failed without retry.
 */
public class InvalidPayloadException extends DispatchException {

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
