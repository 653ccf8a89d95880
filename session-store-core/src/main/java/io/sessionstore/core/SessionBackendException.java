package io.sessionstore.core;

/**
 * Raised when the storage engine cannot be reached or rejects a command.
 *
 * <p>The outcome of the failed operation is unknown. Nothing in this library retries it.
 */
public class SessionBackendException extends SessionStoreException {

    public SessionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
