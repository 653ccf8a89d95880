package io.sessionstore.server.spi;

import java.util.Objects;

/**
 * One field copied into a hot layer during warm-up.
 *
 * @param ttlSeconds lifetime of the hot copy, or {@code null} for none
 */
public record WarmEntry(String field, byte[] value, Long ttlSeconds) {

    public WarmEntry {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        if (ttlSeconds != null && ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
    }
}
