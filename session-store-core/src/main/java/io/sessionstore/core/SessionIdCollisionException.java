package io.sessionstore.core;

import java.util.Objects;

/**
 * Raised when a rename targets an identifier that already holds a live session.
 *
 * <p>The operation that raised it left both sessions untouched. Callers recover by drawing a new
 * identifier and trying again.
 */
public class SessionIdCollisionException extends SessionStoreException {

    private final SessionId source;
    private final SessionId target;

    public SessionIdCollisionException(SessionId source, SessionId target) {
        super("session id already in use: " + Objects.requireNonNull(target, "target"));
        this.source = source;
        this.target = target;
    }

    /**
     * The identifier that was being renamed, or {@code null} when the session was fresh.
     */
    public SessionId source() {
        return source;
    }

    public SessionId target() {
        return target;
    }
}
