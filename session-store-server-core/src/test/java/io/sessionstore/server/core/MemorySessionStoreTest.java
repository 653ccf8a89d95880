package io.sessionstore.server.core;

import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.server.spi.ColdSnapshot;
import io.sessionstore.server.spi.FieldWrite;
import io.sessionstore.server.spi.WarmEntry;
import io.sessionstore.server.spi.WriteStrategy;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemorySessionStoreTest {

    private static final Duration TEN_MINUTES = Duration.ofMinutes(10);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final MemorySessionStore store = new MemorySessionStore(clock);
    private final SessionId id = SessionId.of("s1");

    @Test
    void fieldIsReadableUntilTheEarlierOfFieldAndSessionExpiry() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), Duration.ofSeconds(60))).get(5, TimeUnit.SECONDS);
        store.set(id, FieldWrite.upsert("b", bytes("2"), null).withFieldTtl(Duration.ofSeconds(10)))
                .get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofSeconds(9));
        assertThat(store.get(id, "b").get(5, TimeUnit.SECONDS)).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get(id, "b").get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).isPresent();

        clock.advance(Duration.ofSeconds(50));
        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(store.getAll(id).get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void writeWithoutSessionTtlKeepsCurrentExpiry() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), Duration.ofSeconds(30))).get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(20));
        store.set(id, FieldWrite.upsert("b", bytes("2"), null)).get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofSeconds(10));

        assertThat(store.getAll(id).get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void insertIfAbsentLeavesLiveValueAlone() throws Exception {
        assertThat(store.set(id, FieldWrite.insert("a", bytes("1"), TEN_MINUTES)).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.set(id, FieldWrite.insert("a", bytes("2"), TEN_MINUTES)).get(5, TimeUnit.SECONDS)).isFalse();

        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("1")));
    }

    @Test
    void insertIfAbsentWritesAfterFieldExpired() throws Exception {
        store.set(id, FieldWrite.insert("a", bytes("1"), TEN_MINUTES).withFieldTtl(Duration.ofSeconds(5)))
                .get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(5));

        assertThat(store.set(id, FieldWrite.insert("a", bytes("2"), TEN_MINUTES)).get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void setAndRenameMovesSessionAndWritesField() throws Exception {
        SessionId next = SessionId.of("s2");
        store.set(id, FieldWrite.upsert("a", bytes("1"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);

        boolean written = store.setAndRename(id, next, FieldWrite.upsert("b", bytes("2"), TEN_MINUTES))
                .get(5, TimeUnit.SECONDS);

        assertThat(written).isTrue();
        assertThat(store.getAll(id).get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(store.getAll(next).get(5, TimeUnit.SECONDS)).hasValueSatisfying(m ->
                assertThat(m.fieldNames()).containsExactlyInAnyOrder("a", "b"));
    }

    @Test
    void setAndRenameOfMissingSessionCreatesFreshOne() throws Exception {
        SessionId next = SessionId.of("s2");

        store.setAndRename(id, next, FieldWrite.upsert("a", bytes("1"), Duration.ofSeconds(30))).get(5, TimeUnit.SECONDS);

        assertThat(store.get(next, "a").get(5, TimeUnit.SECONDS)).isPresent();
        clock.advance(Duration.ofSeconds(30));
        assertThat(store.get(next, "a").get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void setAndRenameOntoLiveSessionAbortsWithoutChanges() throws Exception {
        SessionId taken = SessionId.of("taken");
        store.set(id, FieldWrite.upsert("a", bytes("mine"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);
        store.set(taken, FieldWrite.upsert("a", bytes("theirs"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> store.setAndRename(id, taken, FieldWrite.upsert("a", bytes("x"), TEN_MINUTES))
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(SessionIdCollisionException.class);

        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("mine")));
        assertThat(store.get(taken, "a").get(5, TimeUnit.SECONDS)).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("theirs")));
    }

    @Test
    void renameOntoExpiredSessionIsAllowed() throws Exception {
        SessionId stale = SessionId.of("stale");
        store.set(stale, FieldWrite.upsert("a", bytes("old"), Duration.ofSeconds(1))).get(5, TimeUnit.SECONDS);
        store.set(id, FieldWrite.upsert("a", bytes("new"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(1));

        assertThat(store.rename(id, stale, TEN_MINUTES).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.get(stale, "a").get(5, TimeUnit.SECONDS)).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("new")));
    }

    @Test
    void renameOfMissingSessionReportsFalse() throws Exception {
        assertThat(store.rename(id, SessionId.of("s2"), TEN_MINUTES).get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void deleteIsIdempotent() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);

        assertThat(store.delete(id).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.getAll(id).get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(store.delete(id).get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(store.getAll(id).get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void expireWithNonPositiveTtlDeletes() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);

        assertThat(store.expire(id, Duration.ZERO).get(5, TimeUnit.SECONDS)).isTrue();

        assertThat(store.getAll(id).get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void expireExtendsSessionLifetime() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), Duration.ofSeconds(10))).get(5, TimeUnit.SECONDS);

        store.expire(id, Duration.ofSeconds(100)).get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(50));

        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    void removingLastFieldRemovesSession() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);

        assertThat(store.remove(id, "a").get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.remove(id, "a").get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void snapshotCarriesRemainingLifetimeAndHotCap() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("1"), Duration.ofSeconds(100))
                .withStrategy(WriteStrategy.cappedHot(Duration.ofSeconds(20)))).get(5, TimeUnit.SECONDS);
        store.set(id, FieldWrite.upsert("b", bytes("2"), null)
                .withFieldTtl(Duration.ofSeconds(40))
                .withStrategy(WriteStrategy.coldOnly())).get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(10));

        ColdSnapshot snapshot = store.getAllWithMeta(id).get(5, TimeUnit.SECONDS).orElseThrow();

        assertThat(snapshot.sessionTtlSeconds()).isEqualTo(90L);
        assertThat(snapshot.fields()).extracting(ColdSnapshot.Field::name, ColdSnapshot.Field::remainingTtlSeconds,
                        ColdSnapshot.Field::hotCacheTtlSeconds)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("a", 90L, 20L),
                        org.assertj.core.groups.Tuple.tuple("b", 30L, 0L));
    }

    @Test
    void warmWritesBatchWithPerFieldTtl() throws Exception {
        store.warm(id, List.of(new WarmEntry("a", bytes("1"), 5L), new WarmEntry("b", bytes("2"), null)), 60L)
                .get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofSeconds(5));

        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(store.get(id, "b").get(5, TimeUnit.SECONDS)).isPresent();
        clock.advance(Duration.ofSeconds(55));
        assertThat(store.get(id, "b").get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void warmLeavesLiveFieldsAlone() throws Exception {
        store.set(id, FieldWrite.upsert("a", bytes("newer"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);
        store.set(id, FieldWrite.upsert("gone", bytes("old"), TEN_MINUTES).withFieldTtl(Duration.ofSeconds(1)))
                .get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(1));

        store.warm(id, List.of(new WarmEntry("a", bytes("older"), null), new WarmEntry("gone", bytes("again"), null)),
                60L).get(5, TimeUnit.SECONDS);

        assertThat(store.get(id, "a").get(5, TimeUnit.SECONDS)).hasValueSatisfying(v ->
                assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("newer"));
        assertThat(store.get(id, "gone").get(5, TimeUnit.SECONDS)).hasValueSatisfying(v ->
                assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("again"));
    }

    @Test
    void purgeExpiredDropsOnlyExpiredSessions() throws Exception {
        store.set(SessionId.of("short"), FieldWrite.upsert("a", bytes("1"), Duration.ofSeconds(1))).get(5, TimeUnit.SECONDS);
        store.set(SessionId.of("long"), FieldWrite.upsert("a", bytes("1"), TEN_MINUTES)).get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(2));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void concurrentRenamesOntoSameIdYieldExactlyOneWinner() throws Exception {
        SessionId target = SessionId.of("target");
        int contenders = 8;
        for (int i = 0; i < contenders; i++) {
            store.set(SessionId.of("old-" + i), FieldWrite.upsert("owner", bytes("" + i), TEN_MINUTES))
                    .get(5, TimeUnit.SECONDS);
        }

        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Throwable>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                SessionId old = SessionId.of("old-" + i);
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.setAndRename(old, target, FieldWrite.upsert("step", bytes("2"), TEN_MINUTES)).join();
                        return null;
                    } catch (CompletionException e) {
                        return e.getCause();
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Throwable> r : results) {
                Throwable failure = r.get(5, TimeUnit.SECONDS);
                if (failure == null) {
                    winners++;
                } else {
                    assertThat(failure).isInstanceOf(SessionIdCollisionException.class);
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        int untouched = 0;
        for (int i = 0; i < contenders; i++) {
            if (store.get(SessionId.of("old-" + i), "owner").get(5, TimeUnit.SECONDS).isPresent()) {
                assertThat(store.get(SessionId.of("old-" + i), "step").get(5, TimeUnit.SECONDS)).isEmpty();
                untouched++;
            }
        }
        assertThat(untouched).isEqualTo(contenders - 1);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
