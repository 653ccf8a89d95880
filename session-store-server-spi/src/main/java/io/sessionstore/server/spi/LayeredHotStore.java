package io.sessionstore.server.spi;

import io.sessionstore.core.SessionId;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A store fast enough to front a {@link LayeredColdStore}.
 */
public interface LayeredHotStore extends SessionStore {

    /**
     * Writes a batch of fields in one round trip and sets the session lifetime. A field that already holds a
     * live value keeps it: the hot copy may be newer than the cold one it was loaded from.
     *
     * @param sessionTtlSeconds lifetime of the hot session, or {@code null} for none
     */
    CompletableFuture<Void> warm(SessionId id, List<WarmEntry> entries, Long sessionTtlSeconds);
}
