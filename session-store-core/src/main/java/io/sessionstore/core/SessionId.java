package io.sessionstore.core;

import java.util.Base64;
import java.util.Objects;

/**
 * Opaque, unguessable session identifier.
 *
 * <p>Generated identifiers carry {@value #RANDOM_BYTES} random bytes rendered as unpadded base64url,
 * which makes them safe to place in a cookie value without further escaping.
 */
public final class SessionId {

    /** Number of random bytes behind a generated identifier. */
    public static final int RANDOM_BYTES = 16;

    /** Length of the base64url rendering of {@link #RANDOM_BYTES} bytes without padding. */
    public static final int ENCODED_LENGTH = 22;

    private final String value;

    private SessionId(String value) {
        this.value = value;
    }

    /**
     * Encodes raw random bytes as an identifier.
     */
    public static SessionId fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != RANDOM_BYTES) {
            throw new IllegalArgumentException("session id needs " + RANDOM_BYTES + " bytes, got " + bytes.length);
        }
        return new SessionId(Base64.getUrlEncoder().withoutPadding().encodeToString(bytes));
    }

    /**
     * Parses a token as produced by {@link #value()}, e.g. a cookie value sent back by a client.
     *
     * @throws IllegalArgumentException if the token is not a 22 character base64url string
     */
    public static SessionId parse(String token) {
        Objects.requireNonNull(token, "token");
        if (token.length() != ENCODED_LENGTH) {
            throw new IllegalArgumentException("session id must be " + ENCODED_LENGTH + " characters");
        }
        for (int i = 0; i < token.length(); i++) {
            if (!isUrlSafe(token.charAt(i))) {
                throw new IllegalArgumentException("session id contains a non base64url character");
            }
        }
        return new SessionId(token);
    }

    /**
     * Wraps an arbitrary non-blank token without format checks. Intended for fixtures and imports.
     */
    public static SessionId of(String token) {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("session id must not be blank");
        }
        return new SessionId(token);
    }

    public String value() {
        return value;
    }

    private static boolean isUrlSafe(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_';
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof SessionId)) return false;
        return value.equals(((SessionId) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
