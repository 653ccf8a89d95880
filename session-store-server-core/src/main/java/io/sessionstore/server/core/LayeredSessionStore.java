package io.sessionstore.server.core;

import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionMap;
import io.sessionstore.server.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Two-tier {@link SessionStore}: a fast hot store in front of an authoritative cold store.
 *
 * <p>Reads:
 * <ul>
 *   <li>{@link #get} answers from the hot store when it can; on a miss it reads the whole session from the
 *   cold store and copies it into the hot store in one batch, each field bounded by the smaller of its
 *   persisted hot cap and its remaining cold lifetime</li>
 *   <li>{@link #getAll} consults both stores, since either may hold fields the other never received</li>
 * </ul>
 *
 * <p>Writes follow the {@link WriteStrategy} of each {@link FieldWrite}. Renames go to the cold store first;
 * a collision there stops the operation before the hot store is touched.
 *
 * <p>A failure in either store fails the returned future. The store does not roll back the other layer.
 */
public final class LayeredSessionStore<H extends LayeredHotStore, C extends LayeredColdStore> implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(LayeredSessionStore.class);

    private final H hot;
    private final C cold;

    public LayeredSessionStore(H hot, C cold) {
        this.hot = Objects.requireNonNull(hot, "hot");
        this.cold = Objects.requireNonNull(cold, "cold");
    }

    public H hot() {
        return hot;
    }

    public C cold() {
        return cold;
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(SessionId id, String field) {
        Objects.requireNonNull(field, "field");
        return hot.get(id, field).thenCompose(cached -> {
            if (cached.isPresent()) return CompletableFuture.completedFuture(cached);
            return loadFromCold(id, Set.of()).thenApply(snapshot -> snapshot.flatMap(s -> s.fields().stream()
                    .filter(f -> f.name().equals(field))
                    .map(ColdSnapshot.Field::value)
                    .findFirst()));
        });
    }

    @Override
    public CompletableFuture<Optional<SessionMap>> getAll(SessionId id) {
        CompletableFuture<Optional<SessionMap>> hotRead = hot.getAll(id);
        return hotRead.thenCompose(cached -> {
            Set<String> alreadyHot = cached.map(SessionMap::fieldNames).orElse(Set.of());
            return loadFromCold(id, alreadyHot).thenApply(snapshot -> merge(snapshot, cached));
        });
    }

    @Override
    public CompletableFuture<Boolean> set(SessionId id, FieldWrite write) {
        WriteStrategy strategy = write.effectiveStrategy();
        if (!strategy.writesCold()) {
            return hotSessionTtl(id, write).thenCompose(ttl -> hot.set(id, withSessionTtl(write, ttl)));
        }
        return cold.set(id, write).thenCompose(written -> {
            if (!written) return CompletableFuture.completedFuture(false);
            return syncHotField(id, write).thenApply(ignored -> true);
        });
    }

    @Override
    public CompletableFuture<Boolean> setAndRename(SessionId oldId, SessionId newId, FieldWrite write) {
        WriteStrategy strategy = write.effectiveStrategy();
        CompletableFuture<Boolean> coldStep = strategy.writesCold()
                ? cold.setAndRename(oldId, newId, write)
                : cold.rename(oldId, newId, write.sessionTtl()).thenApply(ignored -> true);
        return coldStep.thenCompose(written -> moveHot(oldId, newId, write.sessionTtl()).thenCompose(ignored -> {
            if (!strategy.writesCold()) {
                return hotSessionTtl(newId, write).thenCompose(ttl -> hot.set(newId, withSessionTtl(write, ttl)));
            }
            if (!written) return CompletableFuture.completedFuture(false);
            return syncHotField(newId, write).thenApply(v -> true);
        }));
    }

    @Override
    public CompletableFuture<Boolean> rename(SessionId oldId, SessionId newId, Duration sessionTtl) {
        return cold.rename(oldId, newId, sessionTtl).thenCompose(coldRenamed -> moveHot(oldId, newId, sessionTtl)
                .thenApply(hotRenamed -> coldRenamed || hotRenamed));
    }

    @Override
    public CompletableFuture<Boolean> remove(SessionId id, String field) {
        return cold.remove(id, field).thenCombine(hot.remove(id, field), (c, h) -> c || h);
    }

    @Override
    public CompletableFuture<Boolean> delete(SessionId id) {
        return cold.delete(id).thenCombine(hot.delete(id), (c, h) -> c || h);
    }

    @Override
    public CompletableFuture<Boolean> expire(SessionId id, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) return delete(id);
        return cold.expire(id, ttl).thenCombine(hot.expire(id, ttl), (c, h) -> c || h);
    }

    /**
     * Reads the cold session and copies fields not listed in {@code skip} into the hot store.
     */
    private CompletableFuture<Optional<ColdSnapshot>> loadFromCold(SessionId id, Set<String> skip) {
        return cold.getAllWithMeta(id).thenCompose(snapshot -> {
            if (snapshot.isEmpty()) return CompletableFuture.completedFuture(snapshot);
            List<WarmEntry> entries = warmEntries(snapshot.get(), skip);
            if (entries.isEmpty()) return CompletableFuture.completedFuture(snapshot);
            log.debug("Warming {} fields of session into hot store", entries.size());
            return hot.warm(id, entries, snapshot.get().sessionTtlSeconds()).thenApply(ignored -> snapshot);
        });
    }

    /**
     * Brings the hot copy of a field in line with a write the cold store accepted.
     */
    private CompletableFuture<Boolean> syncHotField(SessionId id, FieldWrite write) {
        WriteStrategy strategy = write.effectiveStrategy();
        if (!strategy.writesHot()) return hot.remove(id, write.field());
        Duration fieldTtl = cap(write.fieldTtl(), strategy.hotCacheTtlSeconds());
        return hotSessionTtl(id, write).thenCompose(ttl -> hot.set(id,
                new FieldWrite(write.field(), write.value(), WriteMode.UPSERT, ttl, fieldTtl, strategy)));
    }

    /**
     * Session lifetime for a hot write. A write that keeps the current expiry borrows what the cold session
     * has left, so a hot session created by that write cannot outlive the cold one.
     */
    private CompletableFuture<Duration> hotSessionTtl(SessionId id, FieldWrite write) {
        if (write.sessionTtl() != null) return CompletableFuture.completedFuture(write.sessionTtl());
        return cold.getAllWithMeta(id).thenApply(snapshot -> snapshot
                .map(ColdSnapshot::sessionTtlSeconds)
                .filter(seconds -> seconds > 0)
                .map(Duration::ofSeconds)
                .orElse(null));
    }

    private static FieldWrite withSessionTtl(FieldWrite write, Duration sessionTtl) {
        return new FieldWrite(write.field(), write.value(), write.mode(), sessionTtl, write.fieldTtl(),
                write.strategy());
    }

    /**
     * Moves whatever the hot store holds under {@code oldId}. The cold store has already vouched that
     * {@code newId} is free, so any hot entry under it is stale.
     */
    private CompletableFuture<Boolean> moveHot(SessionId oldId, SessionId newId, Duration sessionTtl) {
        return hot.delete(newId).thenCompose(ignored -> hot.rename(oldId, newId, sessionTtl));
    }

    static List<WarmEntry> warmEntries(ColdSnapshot snapshot, Set<String> skip) {
        List<WarmEntry> entries = new ArrayList<>();
        for (ColdSnapshot.Field f : snapshot.fields()) {
            if (skip.contains(f.name())) continue;
            Long capSeconds = f.hotCacheTtlSeconds();
            if (capSeconds != null && capSeconds == 0) continue;
            entries.add(new WarmEntry(f.name(), f.value(), min(capSeconds, f.remainingTtlSeconds())));
        }
        return entries;
    }

    private static Optional<SessionMap> merge(Optional<ColdSnapshot> snapshot, Optional<SessionMap> cached) {
        if (snapshot.isEmpty()) return cached;
        if (cached.isEmpty()) return Optional.of(snapshot.get().toSessionMap());
        Map<String, byte[]> merged = cached.get().asMap();
        for (ColdSnapshot.Field f : snapshot.get().fields()) {
            merged.putIfAbsent(f.name(), f.value());
        }
        return Optional.of(new SessionMap(merged));
    }

    private static Duration cap(Duration fieldTtl, Long capSeconds) {
        if (capSeconds == null) return fieldTtl;
        Duration capTtl = Duration.ofSeconds(capSeconds);
        if (fieldTtl == null) return capTtl;
        return fieldTtl.compareTo(capTtl) <= 0 ? fieldTtl : capTtl;
    }

    private static Long min(Long a, Long b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.min(a, b);
    }
}
