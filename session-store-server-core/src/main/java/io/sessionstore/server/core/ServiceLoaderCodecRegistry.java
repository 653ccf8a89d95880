package io.sessionstore.server.core;

import io.sessionstore.core.SessionCodec;
import io.sessionstore.core.SessionCodecException;
import io.sessionstore.core.SessionCodecProvider;

import java.util.*;

/**
 * Looks up {@link SessionCodec}s contributed through {@link java.util.ServiceLoader}.
 *
 * <p>Codecs are keyed by their lower-cased {@link SessionCodec#name()}. When two providers register the same
 * name the one loaded last wins.
 */
public final class ServiceLoaderCodecRegistry {

    private final Map<String, SessionCodec> byName;

    public ServiceLoaderCodecRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Map<String, SessionCodec> map = new LinkedHashMap<>();

        ServiceLoader<SessionCodecProvider> loader = ServiceLoader.load(SessionCodecProvider.class, cl);
        for (SessionCodecProvider p : loader) {
            for (SessionCodec c : p.codecs()) {
                if (c == null || c.name() == null) continue;
                String normalized = normalizeName(c.name());
                if (!normalized.isEmpty()) {
                    map.put(normalized, c);
                }
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public static ServiceLoaderCodecRegistry defaultRegistry() {
        return new ServiceLoaderCodecRegistry(Thread.currentThread().getContextClassLoader());
    }

    public Optional<SessionCodec> find(String name) {
        String normalized = normalizeName(name);
        if (normalized.isEmpty()) return Optional.empty();
        return Optional.ofNullable(byName.get(normalized));
    }

    /**
     * Like {@link #find} but fails when no codec is registered under {@code name}.
     */
    public SessionCodec require(String name) {
        return find(name).orElseThrow(() -> new SessionCodecException(
                "no session codec named '" + name + "'; registered: " + byName.keySet()));
    }

    public Set<String> names() {
        return byName.keySet();
    }

    private static String normalizeName(String name) {
        if (name == null) return "";
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
