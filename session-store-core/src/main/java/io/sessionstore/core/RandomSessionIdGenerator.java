package io.sessionstore.core;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * {@link SessionIdGenerator} drawing {@value SessionId#RANDOM_BYTES} bytes from a {@link SecureRandom}.
 */
public final class RandomSessionIdGenerator implements SessionIdGenerator {

    private final SecureRandom random;

    public RandomSessionIdGenerator() {
        this(new SecureRandom());
    }

    public RandomSessionIdGenerator(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public SessionId next() {
        byte[] bytes = new byte[SessionId.RANDOM_BYTES];
        random.nextBytes(bytes);
        return SessionId.fromBytes(bytes);
    }
}
