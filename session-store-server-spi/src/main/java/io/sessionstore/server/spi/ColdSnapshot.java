package io.sessionstore.server.spi;

import io.sessionstore.core.SessionMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every live field of a session as read from a cold layer, with what a hot layer needs to cache it.
 *
 * @param sessionTtlSeconds remaining session lifetime, or {@code null} when the session does not expire
 * @param fields            live fields in storage order
 */
public record ColdSnapshot(Long sessionTtlSeconds, List<Field> fields) {

    public ColdSnapshot {
        Objects.requireNonNull(fields, "fields");
        fields = List.copyOf(fields);
    }

    public SessionMap toSessionMap() {
        Map<String, byte[]> map = new LinkedHashMap<>();
        for (Field f : fields) {
            map.put(f.name(), f.value());
        }
        return new SessionMap(map);
    }

    /**
     * @param remainingTtlSeconds seconds until the field or its session expires, whichever comes first, or
     *                            {@code null} when neither expires
     * @param hotCacheTtlSeconds  persisted {@link WriteStrategy#hotCacheTtlSeconds()} of the last write
     */
    public record Field(String name, byte[] value, Long remainingTtlSeconds, Long hotCacheTtlSeconds) {

        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }
}
