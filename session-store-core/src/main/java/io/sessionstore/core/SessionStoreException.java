package io.sessionstore.core;

/**
 * Base class for session storage failures.
 *
 * <p>Stores report these through exceptional completion of the futures they return. A missing session
 * or field is never an exception; it is an empty result.
 */
public abstract class SessionStoreException extends RuntimeException {

    protected SessionStoreException(String message) {
        super(message);
    }

    protected SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
