package io.sessionstore.server.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by every {@link Session} a {@link SessionFactory} opens.
 *
 * @param maxAge lifetime applied to a session on every write; also the cookie max-age
 */
public record SessionConfig(Duration maxAge) {

    public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(10);

    public SessionConfig {
        Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
    }

    public static SessionConfig defaults() {
        return new SessionConfig(DEFAULT_MAX_AGE);
    }
}
