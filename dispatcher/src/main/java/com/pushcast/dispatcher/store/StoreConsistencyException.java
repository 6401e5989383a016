package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.DispatchException;

/**
 * A state transition was attempted on a job that is not in a state that
 * allows it, e.g. completing a job another pass has reclaimed. Fatal to the
 * single operation; the scheduler logs and counts it for operators.
 */
public class StoreConsistencyException extends DispatchException {

    public StoreConsistencyException(String message) {
        super(message);
    }
}
