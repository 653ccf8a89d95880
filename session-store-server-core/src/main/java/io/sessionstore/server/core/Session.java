package io.sessionstore.server.core;

import io.sessionstore.core.SessionCodec;
import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.core.SessionIdGenerator;
import io.sessionstore.core.SessionMap;
import io.sessionstore.server.spi.FieldWrite;
import io.sessionstore.server.spi.SessionStore;
import io.sessionstore.server.spi.WriteMode;
import io.sessionstore.server.spi.WriteStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Handle on one client's session, usually scoped to a single request.
 *
 * <p>Identifier rotation comes in two forms:
 * <ul>
 *   <li>{@link #prepareRegenerate()} draws a new identifier and parks it. The next field write moves the
 *   session to it and writes the field in one atomic store operation, so a fixed identifier never carries the
 *   state that write introduces (typically the authenticated user).</li>
 *   <li>{@link #regenerate()} moves the session right away without writing anything.</li>
 * </ul>
 *
 * <p>If the new identifier is already taken the store refuses the move, the parked identifier is dropped and
 * the write fails with {@link SessionIdCollisionException}. Call {@link #prepareRegenerate()} again to retry.
 *
 * <p>Instances are thread-safe, but concurrent writes through one handle race for the parked identifier; only
 * the first consumes it.
 */
public final class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final SessionStore store;
    private final SessionCodec codec;
    private final SessionIdGenerator ids;

    private SessionId id;
    private SessionId pendingId;
    private Duration maxAge;
    private boolean changed;
    private boolean deleted;

    Session(SessionStore store, SessionCodec codec, SessionIdGenerator ids, SessionId id, Duration maxAge) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
        this.id = id;
    }

    public <T> CompletableFuture<Optional<T>> get(String field, Class<T> type) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(type, "type");
        SessionId current = id();
        if (current == null) return CompletableFuture.completedFuture(Optional.empty());
        return store.get(current, field).thenApply(raw -> raw.map(bytes -> codec.decode(bytes, type)));
    }

    public CompletableFuture<Optional<SessionMap>> getAll() {
        SessionId current = id();
        if (current == null) return CompletableFuture.completedFuture(Optional.empty());
        return store.getAll(current);
    }

    /**
     * Writes {@code value} unless the field already holds a live value.
     *
     * @return whether the value was written
     */
    public CompletableFuture<Boolean> insert(String field, Object value) {
        return write(field, value, WriteMode.INSERT_IF_ABSENT, null, null);
    }

    public CompletableFuture<Boolean> insert(String field, Object value, Duration fieldTtl) {
        return write(field, value, WriteMode.INSERT_IF_ABSENT, fieldTtl, null);
    }

    public CompletableFuture<Boolean> insert(String field, Object value, Duration fieldTtl, WriteStrategy strategy) {
        return write(field, value, WriteMode.INSERT_IF_ABSENT, fieldTtl, strategy);
    }

    /**
     * Writes {@code value}, replacing any existing one.
     */
    public CompletableFuture<Boolean> update(String field, Object value) {
        return write(field, value, WriteMode.UPSERT, null, null);
    }

    public CompletableFuture<Boolean> update(String field, Object value, Duration fieldTtl) {
        return write(field, value, WriteMode.UPSERT, fieldTtl, null);
    }

    public CompletableFuture<Boolean> update(String field, Object value, Duration fieldTtl, WriteStrategy strategy) {
        return write(field, value, WriteMode.UPSERT, fieldTtl, strategy);
    }

    /**
     * Parks a fresh identifier for the next write, replacing any identifier parked earlier. No storage access.
     */
    public synchronized SessionId prepareRegenerate() {
        pendingId = ids.next();
        log.debug("Prepared session id regeneration");
        return pendingId;
    }

    /**
     * Moves the session to a fresh identifier now.
     *
     * @return the new identifier, or empty when there was no stored session to move
     */
    public CompletableFuture<Optional<SessionId>> regenerate() {
        SessionId current;
        Duration ttl;
        synchronized (this) {
            current = id;
            ttl = maxAge;
        }
        if (current == null) return CompletableFuture.completedFuture(Optional.empty());
        SessionId next = ids.next();
        return store.rename(current, next, ttl).thenApply(renamed -> {
            if (!renamed) return Optional.<SessionId>empty();
            synchronized (this) {
                if (Objects.equals(id, current)) id = next;
                changed = true;
            }
            log.debug("Regenerated session id");
            return Optional.of(next);
        });
    }

    public CompletableFuture<Boolean> remove(String field) {
        Objects.requireNonNull(field, "field");
        SessionId current = id();
        if (current == null) return CompletableFuture.completedFuture(false);
        return store.remove(current, field).thenApply(removed -> {
            if (removed) markChanged();
            return removed;
        });
    }

    /**
     * Deletes the stored session. Later writes start a new session under a new identifier.
     */
    public CompletableFuture<Boolean> delete() {
        SessionId current;
        synchronized (this) {
            current = id;
            pendingId = null;
        }
        if (current == null) {
            markDeleted(null);
            return CompletableFuture.completedFuture(false);
        }
        return store.delete(current).thenApply(existed -> {
            markDeleted(current);
            return existed;
        });
    }

    /**
     * Resets the session lifetime. A zero or negative {@code ttl} deletes the session.
     */
    public CompletableFuture<Boolean> expire(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) return delete();
        SessionId current;
        synchronized (this) {
            maxAge = ttl;
            current = id;
        }
        if (current == null) return CompletableFuture.completedFuture(false);
        return store.expire(current, ttl).thenApply(applied -> {
            if (applied) markChanged();
            return applied;
        });
    }

    /**
     * Changes the lifetime applied by subsequent writes without touching storage.
     */
    public synchronized void setExpiration(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        maxAge = ttl;
    }

    public synchronized SessionId id() {
        return id;
    }

    public synchronized Optional<SessionId> pendingId() {
        return Optional.ofNullable(pendingId);
    }

    public synchronized Duration maxAge() {
        return maxAge;
    }

    /**
     * Whether this handle changed the stored session, i.e. whether the cookie needs refreshing.
     */
    public synchronized boolean isChanged() {
        return changed;
    }

    public synchronized boolean isDeleted() {
        return deleted;
    }

    private CompletableFuture<Boolean> write(String field, Object value, WriteMode mode, Duration fieldTtl,
                                             WriteStrategy strategy) {
        Objects.requireNonNull(field, "field");
        byte[] bytes;
        try {
            bytes = codec.encode(value);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        SessionId current;
        SessionId pending;
        Duration ttl;
        synchronized (this) {
            current = id;
            pending = pendingId;
            ttl = maxAge;
        }
        FieldWrite write = new FieldWrite(field, bytes, mode, ttl, fieldTtl, strategy);

        SessionId target;
        CompletableFuture<Boolean> op;
        if (pending != null && current != null) {
            target = pending;
            op = store.setAndRename(current, pending, write);
        } else if (pending != null) {
            target = pending;
            op = store.set(pending, write);
        } else if (current == null) {
            target = ids.next();
            op = store.set(target, write);
        } else {
            target = current;
            op = store.set(current, write);
        }

        return op.handle((written, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof SessionIdCollisionException && pending != null) {
                    clearPending(pending);
                    log.warn("Session id regeneration collided; pending id discarded");
                }
                throw error instanceof CompletionException ? (CompletionException) error : new CompletionException(cause);
            }
            bind(current, pending, target, written);
            return written;
        });
    }

    private synchronized void bind(SessionId previous, SessionId pending, SessionId target, boolean written) {
        if (pending != null && pending.equals(pendingId)) pendingId = null;
        boolean moved = pending != null && previous != null;
        if (!written && !moved) return;
        if (Objects.equals(id, previous)) id = target;
        deleted = false;
        changed = true;
    }

    private synchronized void clearPending(SessionId pending) {
        if (pending.equals(pendingId)) pendingId = null;
    }

    private synchronized void markChanged() {
        changed = true;
    }

    private synchronized void markDeleted(SessionId previous) {
        if (Objects.equals(id, previous)) id = null;
        deleted = true;
        changed = true;
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }
}
