package io.sessionstore.server.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * A single field write and the lifetimes that come with it.
 *
 * @param field      field name, never blank
 * @param value      stored bytes
 * @param mode       upsert or insert-if-absent
 * @param sessionTtl new session lifetime, or {@code null} to keep the current one
 * @param fieldTtl   lifetime of this field alone, or {@code null} for none
 * @param strategy   layered placement, or {@code null} for {@link WriteStrategy#writeThrough()}
 */
public record FieldWrite(String field, byte[] value, WriteMode mode, Duration sessionTtl, Duration fieldTtl,
                         WriteStrategy strategy) {

    public FieldWrite {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(mode, "mode");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        requirePositive(sessionTtl, "sessionTtl");
        requirePositive(fieldTtl, "fieldTtl");
    }

    public static FieldWrite upsert(String field, byte[] value, Duration sessionTtl) {
        return new FieldWrite(field, value, WriteMode.UPSERT, sessionTtl, null, null);
    }

    public static FieldWrite insert(String field, byte[] value, Duration sessionTtl) {
        return new FieldWrite(field, value, WriteMode.INSERT_IF_ABSENT, sessionTtl, null, null);
    }

    public FieldWrite withFieldTtl(Duration ttl) {
        return new FieldWrite(field, value, mode, sessionTtl, ttl, strategy);
    }

    public FieldWrite withStrategy(WriteStrategy s) {
        return new FieldWrite(field, value, mode, sessionTtl, fieldTtl, s);
    }

    public WriteStrategy effectiveStrategy() {
        return strategy == null ? WriteStrategy.writeThrough() : strategy;
    }

    /**
     * Session TTL in whole seconds (rounded up), or {@code null} to keep the current one.
     */
    public Long sessionTtlSeconds() {
        return seconds(sessionTtl);
    }

    /**
     * Field TTL in whole seconds (rounded up), or {@code null} for none.
     */
    public Long fieldTtlSeconds() {
        return seconds(fieldTtl);
    }

    /**
     * Converts a positive duration to whole seconds, never rounding down to zero.
     */
    public static Long seconds(Duration ttl) {
        if (ttl == null) return null;
        long s = ttl.getSeconds();
        return ttl.getNano() > 0 ? s + 1 : Math.max(1L, s);
    }

    private static void requirePositive(Duration ttl, String name) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    @Override
    public String toString() {
        return "FieldWrite[field=" + field + ", bytes=" + value.length + ", mode=" + mode
                + ", sessionTtl=" + sessionTtl + ", fieldTtl=" + fieldTtl + ", strategy=" + strategy + "]";
    }
}
