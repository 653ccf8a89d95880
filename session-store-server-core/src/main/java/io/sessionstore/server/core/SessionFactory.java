package io.sessionstore.server.core;

import io.sessionstore.core.RandomSessionIdGenerator;
import io.sessionstore.core.SessionCodec;
import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdGenerator;
import io.sessionstore.server.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Opens {@link Session} handles over one store.
 *
 * <p>Typically one factory per application, one session per request:
 * <pre>{@code
 * SessionFactory sessions = new SessionFactory(store, codec);
 * Session session = sessions.open(cookieValue);
 * session.update("user", user).join();
 * }</pre>
 */
public final class SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SessionFactory.class);

    private final SessionStore store;
    private final SessionCodec codec;
    private final SessionIdGenerator ids;
    private final SessionConfig config;

    public SessionFactory(SessionStore store, SessionCodec codec) {
        this(store, codec, new RandomSessionIdGenerator(), SessionConfig.defaults());
    }

    public SessionFactory(SessionStore store, SessionCodec codec, SessionIdGenerator ids, SessionConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * A session without an identifier; the first write assigns one.
     */
    public Session open() {
        return new Session(store, codec, ids, null, config.maxAge());
    }

    /**
     * A session bound to the identifier a client sent back. Missing or malformed tokens yield a fresh
     * session instead of an error.
     */
    public Session open(String token) {
        if (token == null || token.isBlank()) return open();
        try {
            return open(SessionId.parse(token));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed session token: {}", e.getMessage());
            return open();
        }
    }

    public Session open(SessionId id) {
        return new Session(store, codec, ids, Objects.requireNonNull(id, "id"), config.maxAge());
    }

    public SessionStore store() {
        return store;
    }

    public SessionCodec codec() {
        return codec;
    }

    public SessionConfig config() {
        return config;
    }
}
