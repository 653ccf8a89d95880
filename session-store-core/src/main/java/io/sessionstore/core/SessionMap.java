package io.sessionstore.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of every live field of one session, still in stored form.
 *
 * <p>Values are decoded lazily through {@link #get(String, Class, SessionCodec)}.
 */
public final class SessionMap {

    private final Map<String, byte[]> fields;

    public SessionMap(Map<String, byte[]> fields) {
        Objects.requireNonNull(fields, "fields");
        Map<String, byte[]> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "field"),
                Objects.requireNonNull(value, "value").clone()));
        this.fields = Collections.unmodifiableMap(copy);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Optional<byte[]> raw(String field) {
        byte[] value = fields.get(field);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    public <T> Optional<T> get(String field, Class<T> type, SessionCodec codec) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        byte[] value = fields.get(field);
        if (value == null) return Optional.empty();
        return Optional.ofNullable(codec.decode(value, type));
    }

    /**
     * Returns a copy of the underlying map.
     */
    public Map<String, byte[]> asMap() {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> copy.put(name, value.clone()));
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof SessionMap)) return false;
        Map<String, byte[]> theirs = ((SessionMap) other).fields;
        if (!fields.keySet().equals(theirs.keySet())) return false;
        for (Map.Entry<String, byte[]> e : fields.entrySet()) {
            if (!Arrays.equals(e.getValue(), theirs.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, byte[]> e : fields.entrySet()) {
            h += e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return "SessionMap" + fields.keySet();
    }
}
