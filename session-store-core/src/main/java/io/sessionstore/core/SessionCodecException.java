package io.sessionstore.core;

/**
 * Raised when a value cannot be encoded for storage or decoded back into the requested type.
 */
public class SessionCodecException extends SessionStoreException {

    public SessionCodecException(String message) {
        super(message);
    }

    public SessionCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
