package io.sessionstore.spring.starter;

import io.lettuce.core.api.StatefulRedisConnection;
import io.sessionstore.core.RandomSessionIdGenerator;
import io.sessionstore.core.SessionCodec;
import io.sessionstore.core.SessionIdGenerator;
import io.sessionstore.postgres.PostgresSessionStore;
import io.sessionstore.redis.RedisSessionStore;
import io.sessionstore.server.core.LayeredSessionStore;
import io.sessionstore.server.core.MemorySessionStore;
import io.sessionstore.server.core.ServiceLoaderCodecRegistry;
import io.sessionstore.server.core.SessionConfig;
import io.sessionstore.server.core.SessionFactory;
import io.sessionstore.server.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Auto-configuration for the session store.
 *
 * <p>Provides default beans for {@link SessionStore}, {@link SessionCodec}, {@link SessionIdGenerator} and
 * {@link SessionFactory}. Each can be overridden by defining your own bean.
 *
 * <p>The store is chosen by {@code session-store.backend}:
 * <ul>
 *   <li>{@code memory} (default): a {@link MemorySessionStore}, for tests and single-node development;</li>
 *   <li>{@code redis}: a {@link RedisSessionStore} over an existing
 *       {@code StatefulRedisConnection<String, byte[]>} bean, opened with {@link RedisSessionStore#codec()};</li>
 *   <li>{@code postgres}: a {@link PostgresSessionStore} over the application's {@link DataSource};</li>
 *   <li>{@code layered}: both of the above, Redis as the hot layer in front of PostgreSQL.</li>
 * </ul>
 *
 * <p>Example Redis connection bean:
 * <pre>{@code
 * @Bean(destroyMethod = "close")
 * public StatefulRedisConnection<String, byte[]> sessionConnection(RedisClient client) {
 *     return client.connect(RedisSessionStore.codec());
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass(SessionFactory.class)
@EnableConfigurationProperties(SessionStoreProperties.class)
public class SessionStoreAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreAutoConfiguration.class);

    private static final String PREFIX = "session-store";

    /**
     * Looks the configured codec up among those registered through {@code SessionCodecProvider}.
     */
    @Bean
    @ConditionalOnMissingBean
    public SessionCodec sessionCodec(SessionStoreProperties properties) {
        return ServiceLoaderCodecRegistry.defaultRegistry().require(properties.getCodec());
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionIdGenerator sessionIdGenerator() {
        return new RandomSessionIdGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionFactory sessionFactory(SessionStore store, SessionCodec codec, SessionIdGenerator ids,
                                         SessionStoreProperties properties) {
        return new SessionFactory(store, codec, ids, new SessionConfig(properties.getMaxAge()));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(SessionStore.class)
    @ConditionalOnProperty(prefix = PREFIX, name = "backend", havingValue = "memory", matchIfMissing = true)
    static class MemoryBackendConfiguration {

        @Bean
        public MemorySessionStore sessionStore() {
            log.warn("Using the in-memory session store; sessions are lost on restart and not shared between nodes");
            return new MemorySessionStore();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RedisSessionStore.class)
    @ConditionalOnMissingBean(SessionStore.class)
    @ConditionalOnProperty(prefix = PREFIX, name = "backend", havingValue = "redis")
    static class RedisBackendConfiguration {

        @Bean
        public RedisSessionStore sessionStore(StatefulRedisConnection<String, byte[]> connection,
                                              SessionStoreProperties properties) {
            return redisStore(connection, properties);
        }

        static RedisSessionStore redisStore(StatefulRedisConnection<String, byte[]> connection,
                                            SessionStoreProperties properties) {
            return RedisSessionStore.builder(connection.async())
                    .keyPrefix(properties.getRedis().getKeyPrefix())
                    .build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(PostgresSessionStore.class)
    @ConditionalOnMissingBean(SessionStore.class)
    @ConditionalOnProperty(prefix = PREFIX, name = "backend", havingValue = "postgres")
    static class PostgresBackendConfiguration {

        @Bean
        public PostgresSessionStore sessionStore(DataSource dataSource, SessionStoreProperties properties) {
            return postgresStore(dataSource, properties);
        }

        static PostgresSessionStore postgresStore(DataSource dataSource, SessionStoreProperties properties) {
            SessionStoreProperties.Postgres pg = properties.getPostgres();
            return PostgresSessionStore.builder(dataSource)
                    .schema(pg.getSchema())
                    .sessionsTable(pg.getSessionsTable())
                    .fieldsTable(pg.getFieldsTable())
                    .createSchema(pg.isCreateSchema())
                    .cleanupInterval(pg.getCleanupInterval())
                    .build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({RedisSessionStore.class, PostgresSessionStore.class})
    @ConditionalOnMissingBean(SessionStore.class)
    @ConditionalOnProperty(prefix = PREFIX, name = "backend", havingValue = "layered")
    static class LayeredBackendConfiguration {

        /**
         * Registered as a bean of its own so the container closes it.
         */
        @Bean
        public PostgresSessionStore sessionStoreColdLayer(DataSource dataSource, SessionStoreProperties properties) {
            return PostgresBackendConfiguration.postgresStore(dataSource, properties);
        }

        @Bean
        @Primary
        public LayeredSessionStore<RedisSessionStore, PostgresSessionStore> sessionStore(
                StatefulRedisConnection<String, byte[]> connection,
                PostgresSessionStore sessionStoreColdLayer,
                SessionStoreProperties properties) {
            return new LayeredSessionStore<>(RedisBackendConfiguration.redisStore(connection, properties),
                    sessionStoreColdLayer);
        }
    }
}
