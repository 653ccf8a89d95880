package io.sessionstore.server.spi;

/**
 * How a field write treats an existing live value.
 */
public enum WriteMode {
    /** Replace any existing value. */
    UPSERT,
    /** Leave an existing live value untouched and report that nothing was written. */
    INSERT_IF_ABSENT
}
