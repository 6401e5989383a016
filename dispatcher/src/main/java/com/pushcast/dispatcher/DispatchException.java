package com.pushcast.dispatcher;

/**
 * Root of every error raised by the dispatcher core.
 *
 * Unchecked, like the rest of the codebase: creation-time subclasses reach the
 * REST layer and become 4xx responses, execution-time subclasses are handled
 * inside the scheduler loop and only show up in job state and logs.
 */
public abstract class DispatchException extends RuntimeException {

    protected DispatchException(String message) {
        super(message);
    }

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
