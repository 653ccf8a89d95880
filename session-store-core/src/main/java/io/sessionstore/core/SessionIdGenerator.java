package io.sessionstore.core;

/**
 * Source of fresh session identifiers.
 *
 * <p>Implementations must be thread-safe and must produce values an attacker cannot predict.
 */
@FunctionalInterface
public interface SessionIdGenerator {

    SessionId next();
}
