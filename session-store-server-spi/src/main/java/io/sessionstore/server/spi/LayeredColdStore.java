package io.sessionstore.server.spi;

import io.sessionstore.core.SessionId;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The authoritative side of a layered store.
 *
 * <p>Cold stores persist {@link WriteStrategy#hotCacheTtlSeconds()} with each field written through
 * {@link #set} or {@link #setAndRename} and return it from {@link #getAllWithMeta}.
 */
public interface LayeredColdStore extends SessionStore {

    CompletableFuture<Optional<ColdSnapshot>> getAllWithMeta(SessionId id);
}
