package io.sessionstore.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.sessionstore.core.SessionCodec;
import io.sessionstore.core.SessionCodecException;

import java.util.Objects;

/**
 * Jackson implementation of {@link SessionCodec}.
 *
 * <p>{@link #json()} stores values as JSON text, {@link #cbor()} as the more compact CBOR binary form. Both
 * understand {@code java.time} types.
 */
public final class JacksonSessionCodec implements SessionCodec {

    public static final String JSON = "json";
    public static final String CBOR = "cbor";

    private final String name;
    private final ObjectMapper mapper;

    /**
     * Creates a JSON codec with the default ObjectMapper.
     */
    public JacksonSessionCodec() {
        this(JSON, defaults(new ObjectMapper()));
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     * @param name   name the codec is registered under
     * @param mapper the ObjectMapper to use
     */
    public JacksonSessionCodec(String name, ObjectMapper mapper) {
        this.name = Objects.requireNonNull(name, "name");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static JacksonSessionCodec json() {
        return new JacksonSessionCodec();
    }

    public static JacksonSessionCodec cbor() {
        return new JacksonSessionCodec(CBOR, defaults(new ObjectMapper(new CBORFactory())));
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public byte[] encode(Object value) throws SessionCodecException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new SessionCodecException("Failed to serialize " + describe(value) + " to " + name, e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) throws SessionCodecException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(type, "type");
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new SessionCodecException("Failed to deserialize " + name + " bytes to " + type.getName(), e);
        }
    }

    private static ObjectMapper defaults(ObjectMapper mapper) {
        return mapper.registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
