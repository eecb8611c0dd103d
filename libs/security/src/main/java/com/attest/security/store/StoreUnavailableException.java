package com.attest.security.store;

/**
 * Raised by a store when the backing persistence cannot be reached.
 *
 * <p>Callers must let it propagate: an outage is not an authentication or authorization result.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
