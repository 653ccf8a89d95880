package io.sessionstore.server.spi;

import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.core.SessionMap;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous session storage.
 *
 * <p>A session is a set of named byte fields behind a {@link SessionId}. The session may carry an expiry
 * and every field may carry its own; once either has passed, the field reads as absent. A session without
 * live fields reads as absent. Expiry is always judged by the storage engine's own clock.
 *
 * <p>Every operation is atomic: it takes effect entirely or not at all. Failures complete the returned
 * future exceptionally with a {@link io.sessionstore.core.SessionStoreException}; absence is never a failure.
 *
 * <p>Implementations must be thread-safe and must not block the calling thread on I/O.
 */
public interface SessionStore {

    /**
     * Reads one field.
     */
    CompletableFuture<Optional<byte[]>> get(SessionId id, String field);

    /**
     * Reads every live field of a session.
     *
     * @return empty when the session is missing, expired or has no live field
     */
    CompletableFuture<Optional<SessionMap>> getAll(SessionId id);

    /**
     * Writes one field, creating the session when needed, and applies the TTLs of {@code write}.
     *
     * @return {@code false} only when {@link WriteMode#INSERT_IF_ABSENT} found a live value
     */
    CompletableFuture<Boolean> set(SessionId id, FieldWrite write);

    /**
     * Moves the session from {@code oldId} to {@code newId} and writes one field under {@code newId}, as a
     * single step. When nothing is stored under {@code oldId} a fresh session is created under {@code newId}.
     *
     * <p>If a live session already exists under {@code newId}, the future fails with
     * {@link SessionIdCollisionException} and neither session is modified.
     *
     * @return whether the field value was written
     */
    CompletableFuture<Boolean> setAndRename(SessionId oldId, SessionId newId, FieldWrite write);

    /**
     * Moves the session from {@code oldId} to {@code newId} without touching its fields.
     *
     * <p>Collision rules are those of {@link #setAndRename}.
     *
     * @param sessionTtl new session lifetime, or {@code null} to keep the current one
     * @return {@code false} when nothing live was stored under {@code oldId}
     */
    CompletableFuture<Boolean> rename(SessionId oldId, SessionId newId, Duration sessionTtl);

    /**
     * Removes one field. The session disappears with its last field.
     */
    CompletableFuture<Boolean> remove(SessionId id, String field);

    /**
     * Removes the whole session. Deleting a missing session succeeds with {@code false}.
     */
    CompletableFuture<Boolean> delete(SessionId id);

    /**
     * Resets the session lifetime. A zero or negative {@code ttl} deletes the session.
     */
    CompletableFuture<Boolean> expire(SessionId id, Duration ttl);
}
