package io.sessionstore.server.core;

import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.core.SessionMap;
import io.sessionstore.server.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process {@link SessionStore}.
 *
 * <p>Sessions live in a {@link ConcurrentHashMap} and disappear on restart. Each identifier maps onto one of
 * {@value #STRIPES} locks; a rename holds the locks of both identifiers, taken in stripe order. Expired
 * entries are evicted lazily on access and by {@link #purgeExpired()}.
 *
 * <p>The store implements both layered capabilities, so it can serve as the hot side in front of a
 * database or as a cold side in tests.
 */
public final class MemorySessionStore implements LayeredHotStore, LayeredColdStore {

    private static final Logger log = LoggerFactory.getLogger(MemorySessionStore.class);

    private static final int STRIPES = 64;

    private final Map<SessionId, Entry> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];
    private final Clock clock;

    public MemorySessionStore() {
        this(Clock.systemUTC());
    }

    public MemorySessionStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(SessionId id, String field) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(field, "field");
        return locked(id, () -> {
            Entry e = live(id, clock.instant());
            if (e == null) return Optional.empty();
            Field f = e.fields.get(field);
            return f == null ? Optional.empty() : Optional.of(f.value.clone());
        });
    }

    @Override
    public CompletableFuture<Optional<SessionMap>> getAll(SessionId id) {
        Objects.requireNonNull(id, "id");
        return locked(id, () -> {
            Entry e = live(id, clock.instant());
            if (e == null) return Optional.empty();
            Map<String, byte[]> map = new LinkedHashMap<>();
            e.fields.forEach((name, f) -> map.put(name, f.value));
            return Optional.of(new SessionMap(map));
        });
    }

    @Override
    public CompletableFuture<Optional<ColdSnapshot>> getAllWithMeta(SessionId id) {
        Objects.requireNonNull(id, "id");
        return locked(id, () -> {
            Instant now = clock.instant();
            Entry e = live(id, now);
            if (e == null) return Optional.empty();
            List<ColdSnapshot.Field> fields = new ArrayList<>();
            e.fields.forEach((name, f) -> fields.add(new ColdSnapshot.Field(
                    name, f.value, remaining(earliest(f.expiresAt, e.expiresAt), now), f.hotCacheTtlSeconds)));
            return Optional.of(new ColdSnapshot(remaining(e.expiresAt, now), fields));
        });
    }

    @Override
    public CompletableFuture<Boolean> set(SessionId id, FieldWrite write) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(write, "write");
        return locked(id, () -> {
            Instant now = clock.instant();
            Entry e = live(id, now);
            if (e == null) e = new Entry();
            boolean written = e.write(write, now);
            if (!written) return false;
            e.applySessionTtl(write.sessionTtl(), now);
            sessions.put(id, e);
            return true;
        });
    }

    @Override
    public CompletableFuture<Boolean> setAndRename(SessionId oldId, SessionId newId, FieldWrite write) {
        Objects.requireNonNull(write, "write");
        return lockedPair(oldId, newId, () -> {
            Instant now = clock.instant();
            Entry e = take(oldId, newId, now);
            if (e == null) e = new Entry();
            boolean written = e.write(write, now);
            e.applySessionTtl(write.sessionTtl(), now);
            if (!e.fields.isEmpty()) sessions.put(newId, e);
            return written;
        });
    }

    @Override
    public CompletableFuture<Boolean> rename(SessionId oldId, SessionId newId, Duration sessionTtl) {
        return lockedPair(oldId, newId, () -> {
            Instant now = clock.instant();
            Entry e = take(oldId, newId, now);
            if (e == null) return false;
            e.applySessionTtl(sessionTtl, now);
            sessions.put(newId, e);
            return true;
        });
    }

    @Override
    public CompletableFuture<Boolean> remove(SessionId id, String field) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(field, "field");
        return locked(id, () -> {
            Entry e = live(id, clock.instant());
            if (e == null) return false;
            boolean removed = e.fields.remove(field) != null;
            if (e.fields.isEmpty()) sessions.remove(id);
            return removed;
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(SessionId id) {
        Objects.requireNonNull(id, "id");
        return locked(id, () -> {
            boolean existed = live(id, clock.instant()) != null;
            sessions.remove(id);
            return existed;
        });
    }

    @Override
    public CompletableFuture<Boolean> expire(SessionId id, Duration ttl) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) return delete(id);
        return locked(id, () -> {
            Instant now = clock.instant();
            Entry e = live(id, now);
            if (e == null) return false;
            e.expiresAt = now.plus(ttl);
            return true;
        });
    }

    @Override
    public CompletableFuture<Void> warm(SessionId id, List<WarmEntry> entries, Long sessionTtlSeconds) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entries, "entries");
        return locked(id, () -> {
            if (entries.isEmpty()) return null;
            Instant now = clock.instant();
            Entry e = live(id, now);
            if (e == null) e = new Entry();
            for (WarmEntry w : entries) {
                Instant expiresAt = w.ttlSeconds() == null ? null : now.plusSeconds(w.ttlSeconds());
                e.fields.putIfAbsent(w.field(), new Field(w.value().clone(), expiresAt, null));
            }
            e.expiresAt = sessionTtlSeconds == null ? null : now.plusSeconds(sessionTtlSeconds);
            sessions.put(id, e);
            return null;
        });
    }

    /**
     * Evicts every expired session and field.
     *
     * @return number of sessions removed
     */
    public int purgeExpired() {
        int purged = 0;
        for (SessionId id : new ArrayList<>(sessions.keySet())) {
            ReentrantLock lock = lockFor(id);
            lock.lock();
            try {
                if (sessions.containsKey(id) && live(id, clock.instant()) == null) purged++;
            } finally {
                lock.unlock();
            }
        }
        if (purged > 0) log.debug("Purged {} expired sessions", purged);
        return purged;
    }

    /**
     * Number of sessions held, expired ones included until they are evicted.
     */
    public int size() {
        return sessions.size();
    }

    /**
     * Detaches the live entry under {@code oldId} for a move to {@code newId}. Caller holds both locks.
     */
    private Entry take(SessionId oldId, SessionId newId, Instant now) {
        if (live(newId, now) != null) {
            log.warn("Refusing to rename session onto an identifier already in use");
            throw new SessionIdCollisionException(oldId, newId);
        }
        Entry e = live(oldId, now);
        if (e != null) sessions.remove(oldId);
        return e;
    }

    /**
     * Returns the live entry, evicting expired fields and sessions on the way. Caller holds the lock.
     */
    private Entry live(SessionId id, Instant now) {
        Entry e = sessions.get(id);
        if (e == null) return null;
        if (e.expiresAt != null && !now.isBefore(e.expiresAt)) {
            sessions.remove(id);
            return null;
        }
        e.fields.values().removeIf(f -> f.expiresAt != null && !now.isBefore(f.expiresAt));
        if (e.fields.isEmpty()) {
            sessions.remove(id);
            return null;
        }
        return e;
    }

    private <T> CompletableFuture<T> locked(SessionId id, Supplier<T> op) {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            return CompletableFuture.completedFuture(op.get());
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        } finally {
            lock.unlock();
        }
    }

    private <T> CompletableFuture<T> lockedPair(SessionId oldId, SessionId newId, Supplier<T> op) {
        Objects.requireNonNull(oldId, "oldId");
        Objects.requireNonNull(newId, "newId");
        if (oldId.equals(newId)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("oldId and newId must differ"));
        }
        int a = stripe(oldId);
        int b = stripe(newId);
        ReentrantLock first = locks[Math.min(a, b)];
        ReentrantLock second = locks[Math.max(a, b)];
        first.lock();
        try {
            if (second != first) second.lock();
            try {
                return CompletableFuture.completedFuture(op.get());
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            } finally {
                if (second != first) second.unlock();
            }
        } finally {
            first.unlock();
        }
    }

    private ReentrantLock lockFor(SessionId id) {
        return locks[stripe(id)];
    }

    private static int stripe(SessionId id) {
        return Math.floorMod(id.hashCode(), STRIPES);
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static Long remaining(Instant expiresAt, Instant now) {
        if (expiresAt == null) return null;
        long millis = Duration.between(now, expiresAt).toMillis();
        return Math.max(1L, (millis + 999) / 1000);
    }

    private static final class Entry {
        final Map<String, Field> fields = new LinkedHashMap<>();
        Instant expiresAt;

        boolean write(FieldWrite w, Instant now) {
            if (w.mode() == WriteMode.INSERT_IF_ABSENT && fields.containsKey(w.field())) return false;
            Instant fieldExpiresAt = w.fieldTtl() == null ? null : now.plus(w.fieldTtl());
            fields.put(w.field(), new Field(w.value().clone(), fieldExpiresAt, w.effectiveStrategy().hotCacheTtlSeconds()));
            return true;
        }

        void applySessionTtl(Duration ttl, Instant now) {
            if (ttl != null) expiresAt = now.plus(ttl);
        }
    }

    private static final class Field {
        final byte[] value;
        final Instant expiresAt;
        final Long hotCacheTtlSeconds;

        Field(byte[] value, Instant expiresAt, Long hotCacheTtlSeconds) {
            this.value = value;
            this.expiresAt = expiresAt;
            this.hotCacheTtlSeconds = hotCacheTtlSeconds;
        }
    }
}
