package io.sessionstore.core;

/**
 * Converts application values to the bytes a store persists and back.
 */
public interface SessionCodec {

    /**
     * Short name used to select a codec from configuration, e.g. {@code json}.
     */
    String name();

    byte[] encode(Object value) throws SessionCodecException;

    <T> T decode(byte[] data, Class<T> type) throws SessionCodecException;
}
