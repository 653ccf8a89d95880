package io.sessionstore.spring.starter;

import io.sessionstore.server.core.SessionConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code session-store.*}.
 *
 * <pre>
 * session-store.backend=layered
 * session-store.max-age=30m
 * session-store.redis.key-prefix=app:session:
 * session-store.postgres.schema=auth
 * session-store.postgres.create-schema=true
 * </pre>
 */
@ConfigurationProperties("session-store")
public class SessionStoreProperties {

    public enum Backend {
        MEMORY,
        REDIS,
        POSTGRES,
        /** Redis in front of PostgreSQL. */
        LAYERED
    }

    private Backend backend = Backend.MEMORY;

    private Duration maxAge = SessionConfig.DEFAULT_MAX_AGE;

    /** Name of the codec used for field values, as registered by a {@code SessionCodecProvider}. */
    private String codec = "json";

    private final Redis redis = new Redis();

    private final Postgres postgres = new Postgres();

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }

    public Redis getRedis() {
        return redis;
    }

    public Postgres getPostgres() {
        return postgres;
    }

    public static class Redis {

        private String keyPrefix = "session:";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Postgres {

        private String schema;

        private String sessionsTable = "sessions";

        private String fieldsTable = "session_kv";

        private boolean createSchema;

        /** Delay between expired-row cleanups; zero disables the job. */
        private Duration cleanupInterval = Duration.ofMinutes(5);

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public String getSessionsTable() {
            return sessionsTable;
        }

        public void setSessionsTable(String sessionsTable) {
            this.sessionsTable = sessionsTable;
        }

        public String getFieldsTable() {
            return fieldsTable;
        }

        public void setFieldsTable(String fieldsTable) {
            this.fieldsTable = fieldsTable;
        }

        public boolean isCreateSchema() {
            return createSchema;
        }

        public void setCreateSchema(boolean createSchema) {
            this.createSchema = createSchema;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }
}
