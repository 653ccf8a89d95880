package io.sessionstore.redis;

import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.async.RedisAsyncCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import io.sessionstore.core.SessionBackendException;
import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.core.SessionMap;
import io.sessionstore.core.SessionStoreException;
import io.sessionstore.server.spi.FieldWrite;
import io.sessionstore.server.spi.LayeredHotStore;
import io.sessionstore.server.spi.WarmEntry;
import io.sessionstore.server.spi.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * {@link io.sessionstore.server.spi.SessionStore} on Redis, one hash per session.
 *
 * <p>The session lifetime is the key's {@code EXPIRE}; a field lifetime is set with {@code HEXPIRE}, so the
 * server needs Redis 7.4 or later. Writes and renames are Lua scripts (see {@link RedisScripts}) sent by SHA
 * and re-sent in full when the server answers {@code NOSCRIPT}.
 *
 * <p>The connection must use {@link #codec()}. In a cluster, renames touch two keys and therefore need both
 * identifiers in the same hash slot; use a key prefix with a hash tag if that matters.
 *
 * <p>Example:
 * <pre>{@code
 * RedisClient client = RedisClient.create("redis://localhost:6379");
 * StatefulRedisConnection<String, byte[]> connection = client.connect(RedisSessionStore.codec());
 * RedisSessionStore store = RedisSessionStore.builder(connection.async()).keyPrefix("session:").build();
 * }</pre>
 */
public final class RedisSessionStore implements LayeredHotStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    private static final byte[] NO_TTL = new byte[0];

    private final RedisAsyncCommands<String, byte[]> commands;
    private final String keyPrefix;

    private RedisSessionStore(Builder builder) {
        this.commands = builder.commands;
        this.keyPrefix = builder.keyPrefix;
    }

    public static Builder builder(RedisAsyncCommands<String, byte[]> commands) {
        return new Builder(commands);
    }

    /**
     * Codec the Lettuce connection must be opened with: UTF-8 keys, raw byte values.
     */
    public static RedisCodec<String, byte[]> codec() {
        return RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(SessionId id, String field) {
        Objects.requireNonNull(field, "field");
        return guard("HGET", commands.hget(key(id), field)).thenApply(Optional::ofNullable);
    }

    @Override
    public CompletableFuture<Optional<SessionMap>> getAll(SessionId id) {
        return guard("HGETALL", commands.hgetall(key(id)))
                .thenApply(map -> map == null || map.isEmpty() ? Optional.empty() : Optional.of(new SessionMap(map)));
    }

    @Override
    public CompletableFuture<Boolean> set(SessionId id, FieldWrite write) {
        Objects.requireNonNull(write, "write");
        return run(RedisScripts.SET, new String[]{key(id)}, writeArgs(write))
                .thenApply(result -> result == RedisScripts.WRITTEN);
    }

    @Override
    public CompletableFuture<Boolean> setAndRename(SessionId oldId, SessionId newId, FieldWrite write) {
        Objects.requireNonNull(write, "write");
        return run(RedisScripts.SET_AND_RENAME, new String[]{key(oldId), key(newId)}, writeArgs(write))
                .thenApply(result -> checkCollision(result, oldId, newId) == RedisScripts.WRITTEN);
    }

    @Override
    public CompletableFuture<Boolean> rename(SessionId oldId, SessionId newId, Duration sessionTtl) {
        return run(RedisScripts.RENAME, new String[]{key(oldId), key(newId)}, ttlArg(FieldWrite.seconds(sessionTtl)))
                .thenApply(result -> checkCollision(result, oldId, newId) == RedisScripts.WRITTEN);
    }

    @Override
    public CompletableFuture<Boolean> remove(SessionId id, String field) {
        Objects.requireNonNull(field, "field");
        return guard("HDEL", commands.hdel(key(id), field)).thenApply(removed -> removed != null && removed > 0);
    }

    @Override
    public CompletableFuture<Boolean> delete(SessionId id) {
        return guard("DEL", commands.del(key(id))).thenApply(deleted -> deleted != null && deleted > 0);
    }

    @Override
    public CompletableFuture<Boolean> expire(SessionId id, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) return delete(id);
        return guard("EXPIRE", commands.expire(key(id), FieldWrite.seconds(ttl)))
                .thenApply(Boolean.TRUE::equals);
    }

    @Override
    public CompletableFuture<Void> warm(SessionId id, List<WarmEntry> entries, Long sessionTtlSeconds) {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) return CompletableFuture.completedFuture(null);
        List<byte[]> args = new ArrayList<>(1 + entries.size() * 3);
        args.add(ttlArg(sessionTtlSeconds));
        for (WarmEntry e : entries) {
            args.add(utf8(e.field()));
            args.add(e.value());
            args.add(ttlArg(e.ttlSeconds()));
        }
        return run(RedisScripts.WARM, new String[]{key(id)}, args.toArray(new byte[0][]))
                .thenApply(ignored -> null);
    }

    String key(SessionId id) {
        return keyPrefix + Objects.requireNonNull(id, "id").value();
    }

    private CompletableFuture<Long> run(RedisScripts.Script script, String[] keys, byte[]... args) {
        CompletableFuture<Long> bySha = commands.<Long>evalsha(script.sha(), ScriptOutputType.INTEGER, keys, args)
                .toCompletableFuture();
        CompletableFuture<Long> result = bySha.exceptionallyCompose(e -> {
            if (!isNoScript(e)) return CompletableFuture.failedFuture(e);
            log.debug("Script {} not cached by server, sending body", script.name());
            return commands.<Long>eval(script.body(), ScriptOutputType.INTEGER, keys, args).toCompletableFuture();
        });
        return guard("script " + script.name(), result);
    }

    private static long checkCollision(Long result, SessionId oldId, SessionId newId) {
        if (result != null && result == RedisScripts.COLLISION) {
            log.warn("Refusing to rename session onto an identifier already in use");
            throw new SessionIdCollisionException(oldId, newId);
        }
        return result == null ? RedisScripts.NOT_WRITTEN : result;
    }

    private static byte[][] writeArgs(FieldWrite write) {
        String mode = write.mode() == WriteMode.INSERT_IF_ABSENT ? RedisScripts.MODE_INSERT : RedisScripts.MODE_UPSERT;
        return new byte[][]{
                utf8(write.field()),
                write.value(),
                utf8(mode),
                ttlArg(write.sessionTtlSeconds()),
                ttlArg(write.fieldTtlSeconds())
        };
    }

    private static byte[] ttlArg(Long seconds) {
        return seconds == null ? NO_TTL : utf8(Long.toString(seconds));
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean isNoScript(Throwable t) {
        Throwable cause = unwrap(t);
        return cause.getMessage() != null && cause.getMessage().startsWith("NOSCRIPT");
    }

    private static <T> CompletableFuture<T> guard(String op, CompletionStage<T> stage) {
        return stage.toCompletableFuture().handle((value, error) -> {
            if (error == null) return value;
            Throwable cause = unwrap(error);
            if (cause instanceof SessionStoreException) throw new CompletionException(cause);
            throw new CompletionException(new SessionBackendException("Redis " + op + " failed", cause));
        });
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    public static final class Builder {
        private final RedisAsyncCommands<String, byte[]> commands;
        private String keyPrefix = "";

        private Builder(RedisAsyncCommands<String, byte[]> commands) {
            this.commands = Objects.requireNonNull(commands, "commands");
        }

        /**
         * Prepended to every session identifier to form the Redis key. Empty by default.
         */
        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
            return this;
        }

        public RedisSessionStore build() {
            return new RedisSessionStore(this);
        }
    }
}
