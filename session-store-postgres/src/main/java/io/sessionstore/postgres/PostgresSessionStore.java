package io.sessionstore.postgres;

import io.sessionstore.core.SessionBackendException;
import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.core.SessionMap;
import io.sessionstore.core.SessionStoreException;
import io.sessionstore.server.spi.ColdSnapshot;
import io.sessionstore.server.spi.FieldWrite;
import io.sessionstore.server.spi.LayeredColdStore;
import io.sessionstore.server.spi.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link io.sessionstore.server.spi.SessionStore} on PostgreSQL.
 *
 * <p>Sessions live in two tables (see {@link PostgresSchema}); every operation is a single SQL statement, so
 * it is atomic without an explicit transaction. Renames first delete an expired or empty session row left
 * under the target identifier, so such a row does not count as a collision. Expiry uses the database clock. JDBC calls block, so they run
 * on an {@link Executor}; the returned futures complete on that executor.
 *
 * <p>A background job deletes expired rows every {@link Builder#cleanupInterval(Duration) cleanup interval}.
 * Reads never return expired data whether or not the job has run yet. {@link #close()} stops the job and, if
 * the store created it, the executor.
 *
 * <p>Example:
 * <pre>{@code
 * PostgresSessionStore store = PostgresSessionStore.builder(dataSource)
 *     .schema("auth")
 *     .createSchema(true)
 *     .build();
 * }</pre>
 */
public final class PostgresSessionStore implements LayeredColdStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PostgresSessionStore.class);

    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);

    /** Empty session rows younger than this survive cleanup; a concurrent write may be about to fill them. */
    static final long EMPTY_SESSION_GRACE_SECONDS = 60;

    private final DataSource dataSource;
    private final PostgresTables tables;
    private final PostgresStatements sql;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final ScheduledExecutorService cleanup;

    private PostgresSessionStore(Builder b, PostgresTables tables) {
        this.dataSource = b.dataSource;
        this.tables = tables;
        this.sql = new PostgresStatements(tables);
        if (b.executor != null) {
            this.executor = b.executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads("session-store-postgres-"));
            this.executor = ownedExecutor;
        }
        if (b.cleanupInterval.isZero()) {
            this.cleanup = null;
        } else {
            this.cleanup = Executors.newSingleThreadScheduledExecutor(daemonThreads("session-store-postgres-cleanup-"));
            long millis = b.cleanupInterval.toMillis();
            cleanup.scheduleWithFixedDelay(this::runCleanup, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    public static Builder builder(DataSource dataSource) {
        return new Builder(dataSource);
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(SessionId id, String field) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(field, "field");
        return async("get", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.get)) {
                ps.setString(1, id.value());
                ps.setString(2, field);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getBytes(1)) : Optional.<byte[]>empty();
                }
            }
        });
    }

    @Override
    public CompletableFuture<Optional<SessionMap>> getAll(SessionId id) {
        return getAllWithMeta(id).thenApply(snapshot -> snapshot.map(ColdSnapshot::toSessionMap));
    }

    @Override
    public CompletableFuture<Optional<ColdSnapshot>> getAllWithMeta(SessionId id) {
        Objects.requireNonNull(id, "id");
        return async("getAll", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.getAll)) {
                ps.setString(1, id.value());
                try (ResultSet rs = ps.executeQuery()) {
                    List<ColdSnapshot.Field> fields = new ArrayList<>();
                    Long sessionSeconds = null;
                    while (rs.next()) {
                        fields.add(new ColdSnapshot.Field(
                                rs.getString("field_name"),
                                rs.getBytes("value"),
                                nullableLong(rs, "remaining_seconds"),
                                nullableLong(rs, "hot_ttl_seconds")));
                        sessionSeconds = nullableLong(rs, "session_seconds");
                    }
                    if (fields.isEmpty()) return Optional.<ColdSnapshot>empty();
                    return Optional.of(new ColdSnapshot(sessionSeconds, fields));
                }
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> set(SessionId id, FieldWrite write) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(write, "write");
        return async("set", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.set)) {
                int i = 0;
                ps.setString(++i, id.value());
                ps.setString(++i, write.field());
                ps.setString(++i, id.value());
                setLong(ps, ++i, write.sessionTtlSeconds());
                ps.setBoolean(++i, write.mode() == WriteMode.INSERT_IF_ABSENT);
                ps.setString(++i, write.field());
                ps.setString(++i, write.field());
                ps.setBytes(++i, write.value());
                setLong(ps, ++i, write.fieldTtlSeconds());
                setLong(ps, ++i, write.effectiveStrategy().hotCacheTtlSeconds());
                return singleLong(ps) > 0;
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> setAndRename(SessionId oldId, SessionId newId, FieldWrite write) {
        requireDistinct(oldId, newId);
        Objects.requireNonNull(write, "write");
        boolean insertOnly = write.mode() == WriteMode.INSERT_IF_ABSENT;
        return async("setAndRename", c -> {
            clearStaleTarget(c, newId);
            try (PreparedStatement ps = c.prepareStatement(sql.setAndRename)) {
                int i = 0;
                ps.setString(++i, newId.value());
                setLong(ps, ++i, write.sessionTtlSeconds());
                ps.setString(++i, oldId.value());
                ps.setString(++i, newId.value());
                setLong(ps, ++i, write.sessionTtlSeconds());
                ps.setString(++i, oldId.value());
                ps.setString(++i, write.field());
                ps.setString(++i, oldId.value());
                ps.setString(++i, write.field());
                ps.setBoolean(++i, insertOnly);
                ps.setString(++i, write.field());
                ps.setBytes(++i, write.value());
                setLong(ps, ++i, write.fieldTtlSeconds());
                setLong(ps, ++i, write.effectiveStrategy().hotCacheTtlSeconds());
                ps.setBoolean(++i, insertOnly);
                return singleLong(ps) > 0;
            } catch (SQLException e) {
                throw collisionOr(e, oldId, newId);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> rename(SessionId oldId, SessionId newId, Duration sessionTtl) {
        requireDistinct(oldId, newId);
        return async("rename", c -> {
            clearStaleTarget(c, newId);
            try (PreparedStatement ps = c.prepareStatement(sql.rename)) {
                ps.setString(1, newId.value());
                setLong(ps, 2, FieldWrite.seconds(sessionTtl));
                ps.setString(3, oldId.value());
                ps.setString(4, newId.value());
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    if (rs.getLong("renamed") > 0) return true;
                    if (rs.getBoolean("taken")) throw collision(oldId, newId);
                    return false;
                }
            } catch (SQLException e) {
                throw collisionOr(e, oldId, newId);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> remove(SessionId id, String field) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(field, "field");
        return async("remove", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.remove)) {
                ps.setString(1, id.value());
                ps.setString(2, field);
                ps.setString(3, id.value());
                ps.setString(4, field);
                ps.setString(5, id.value());
                return singleBoolean(ps);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(SessionId id) {
        Objects.requireNonNull(id, "id");
        return async("delete", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.delete)) {
                ps.setString(1, id.value());
                return singleBoolean(ps);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> expire(SessionId id, Duration ttl) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) return delete(id);
        return async("expire", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.expire)) {
                setLong(ps, 1, FieldWrite.seconds(ttl));
                ps.setString(2, id.value());
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Deletes expired sessions and fields now.
     *
     * @return number of sessions removed
     */
    public CompletableFuture<Long> purgeExpired() {
        return async("purgeExpired", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.purgeExpired)) {
                ps.setLong(1, EMPTY_SESSION_GRACE_SECONDS);
                return singleLong(ps);
            }
        });
    }

    /**
     * Stops the cleanup job and the store's own executor. A caller-supplied executor is left running.
     */
    @Override
    public void close() {
        if (cleanup != null) cleanup.shutdownNow();
        if (ownedExecutor != null) ownedExecutor.shutdown();
    }

    PostgresTables tables() {
        return tables;
    }

    private void runCleanup() {
        try {
            long removed = purgeExpired().get();
            if (removed > 0) log.debug("Cleanup removed {} expired sessions", removed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Failed to clean up expired sessions", e.getCause());
        }
    }

    private <T> CompletableFuture<T> async(String op, SqlFunction<T> fn) {
        return CompletableFuture.supplyAsync(() -> {
            try (Connection c = dataSource.getConnection()) {
                return fn.apply(c);
            } catch (SQLException e) {
                log.debug("PostgreSQL {} failed: [{}] {}", op, e.getSQLState(), e.getMessage());
                throw new SessionBackendException("PostgreSQL " + op + " failed", e);
            }
        }, executor);
    }

    /**
     * Removes an expired or empty session row under the rename target. Only rows that read as absent are
     * deleted, so running this outside the rename statement cannot discard a live session.
     */
    private void clearStaleTarget(Connection c, SessionId newId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql.clearStaleTarget)) {
            ps.setString(1, newId.value());
            if (ps.executeUpdate() > 0) log.debug("Cleared stale session row under rename target");
        }
    }

    private SessionStoreException collisionOr(SQLException e, SessionId oldId, SessionId newId) throws SQLException {
        if (PostgresErrors.isUniqueViolation(e, tables.sessionsPrimaryKey())) return collision(oldId, newId);
        throw e;
    }

    private static SessionIdCollisionException collision(SessionId oldId, SessionId newId) {
        log.warn("Refusing to rename session onto an identifier already in use");
        return new SessionIdCollisionException(oldId, newId);
    }

    private static void requireDistinct(SessionId oldId, SessionId newId) {
        Objects.requireNonNull(oldId, "oldId");
        Objects.requireNonNull(newId, "newId");
        if (oldId.equals(newId)) throw new IllegalArgumentException("oldId and newId must differ");
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static long singleLong(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static boolean singleBoolean(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() && rs.getBoolean(1);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    public static final class Builder {
        private final DataSource dataSource;
        private String schema;
        private String sessionsTable = "sessions";
        private String fieldsTable = "session_kv";
        private boolean createSchema;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private Executor executor;

        private Builder(DataSource dataSource) {
            this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        }

        /**
         * Schema holding the tables. Defaults to the connection's search path.
         */
        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder sessionsTable(String name) {
            this.sessionsTable = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder fieldsTable(String name) {
            this.fieldsTable = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Whether {@link #build()} creates the schema, tables and indexes when they are missing. Off by default.
         */
        public Builder createSchema(boolean createSchema) {
            this.createSchema = createSchema;
            return this;
        }

        /**
         * Delay between runs of the expired-row cleanup. {@link Duration#ZERO} disables the job.
         */
        public Builder cleanupInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) throw new IllegalArgumentException("interval must not be negative");
            this.cleanupInterval = interval;
            return this;
        }

        /**
         * Executor for the blocking JDBC calls. By default the store creates and owns a cached thread pool.
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /**
         * Builds the store, creating the tables first when {@link #createSchema(boolean)} is set.
         *
         * @throws SessionBackendException if the tables cannot be created
         */
        public PostgresSessionStore build() {
            PostgresTables tables = new PostgresTables(schema, sessionsTable, fieldsTable);
            if (createSchema) {
                createTables(tables);
            }
            return new PostgresSessionStore(this, tables);
        }

        private void createTables(PostgresTables tables) {
            try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
                for (String ddl : PostgresSchema.statements(tables)) {
                    st.execute(ddl);
                }
                log.info("Session tables ready: {}, {}", tables.sessions(), tables.fields());
            } catch (SQLException e) {
                throw new SessionBackendException("Failed to create session tables", e);
            }
        }
    }
}
