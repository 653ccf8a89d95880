package io.sessionstore.redis;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Lua scripts run server-side so that every store operation is atomic.
 *
 * <p>Common argument conventions:
 * <ul>
 *   <li>a TTL argument is a number of seconds, or the empty string for "keep" (session) or "none" (field)</li>
 *   <li>the mode argument is {@code upsert} or {@code insert}</li>
 *   <li>results are 1 (written), 0 (not written) or -1 (target identifier already in use)</li>
 * </ul>
 *
 * <p>Field expiry relies on {@code HEXPIRE} and {@code HPERSIST}, available from Redis 7.4.
 */
final class RedisScripts {

    static final long WRITTEN = 1L;
    static final long NOT_WRITTEN = 0L;
    static final long COLLISION = -1L;

    static final String MODE_UPSERT = "upsert";
    static final String MODE_INSERT = "insert";

    private static final String WRITE_FIELD = lines(
            "local written",
            "if mode == 'insert' then",
            "    written = redis.call('HSETNX', key, field, value)",
            "else",
            "    redis.call('HSET', key, field, value)",
            "    written = 1",
            "end",
            "if written == 1 then",
            "    if field_ttl ~= '' then",
            "        redis.call('HEXPIRE', key, tonumber(field_ttl), 'FIELDS', 1, field)",
            "    else",
            "        redis.call('HPERSIST', key, 'FIELDS', 1, field)",
            "    end",
            "end");

    /** KEYS: session. ARGV: field, value, mode, session ttl, field ttl. */
    static final Script SET = new Script("set", lines(
            "local key = KEYS[1]",
            "local field = ARGV[1]",
            "local value = ARGV[2]",
            "local mode = ARGV[3]",
            "local session_ttl = ARGV[4]",
            "local field_ttl = ARGV[5]") + WRITE_FIELD + lines(
            "if written == 1 and session_ttl ~= '' then",
            "    redis.call('EXPIRE', key, tonumber(session_ttl))",
            "end",
            "return written"));

    /** KEYS: old session, new session. ARGV: field, value, mode, session ttl, field ttl. */
    static final Script SET_AND_RENAME = new Script("set_and_rename", lines(
            "local old_key = KEYS[1]",
            "local key = KEYS[2]",
            "local field = ARGV[1]",
            "local value = ARGV[2]",
            "local mode = ARGV[3]",
            "local session_ttl = ARGV[4]",
            "local field_ttl = ARGV[5]",
            "if redis.call('EXISTS', key) == 1 then",
            "    return -1",
            "end",
            "if redis.call('EXISTS', old_key) == 1 then",
            "    redis.call('RENAME', old_key, key)",
            "end") + WRITE_FIELD + lines(
            "if session_ttl ~= '' then",
            "    redis.call('EXPIRE', key, tonumber(session_ttl))",
            "end",
            "return written"));

    /** KEYS: old session, new session. ARGV: session ttl. */
    static final Script RENAME = new Script("rename", lines(
            "local old_key = KEYS[1]",
            "local key = KEYS[2]",
            "local session_ttl = ARGV[1]",
            "if redis.call('EXISTS', key) == 1 then",
            "    return -1",
            "end",
            "if redis.call('EXISTS', old_key) == 0 then",
            "    return 0",
            "end",
            "redis.call('RENAME', old_key, key)",
            "if session_ttl ~= '' then",
            "    redis.call('EXPIRE', key, tonumber(session_ttl))",
            "end",
            "return 1"));

    /** KEYS: session. ARGV: session ttl, then (field, value, field ttl) triples. */
    static final Script WARM = new Script("warm", lines(
            "local key = KEYS[1]",
            "local session_ttl = ARGV[1]",
            "for i = 2, #ARGV, 3 do",
            "    local field = ARGV[i]",
            "    local field_ttl = ARGV[i + 2]",
            "    if redis.call('HSETNX', key, field, ARGV[i + 1]) == 1 then",
            "        if field_ttl ~= '' then",
            "            redis.call('HEXPIRE', key, tonumber(field_ttl), 'FIELDS', 1, field)",
            "        else",
            "            redis.call('HPERSIST', key, 'FIELDS', 1, field)",
            "        end",
            "    end",
            "end",
            "if session_ttl ~= '' then",
            "    redis.call('EXPIRE', key, tonumber(session_ttl))",
            "else",
            "    redis.call('PERSIST', key)",
            "end",
            "return 1"));

    private RedisScripts() {
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /**
     * A script body with its SHA-1 digest, as used by {@code EVALSHA}.
     */
    static final class Script {
        private final String name;
        private final String body;
        private final String sha;

        Script(String name, String body) {
            this.name = name;
            this.body = body;
            this.sha = sha1(body);
        }

        String name() {
            return name;
        }

        String body() {
            return body;
        }

        String sha() {
            return sha;
        }
    }

    static String sha1(String body) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(md.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
