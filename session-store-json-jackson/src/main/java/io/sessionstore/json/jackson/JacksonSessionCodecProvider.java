package io.sessionstore.json.jackson;

import io.sessionstore.core.SessionCodec;
import io.sessionstore.core.SessionCodecProvider;

import java.util.List;

/**
 * ServiceLoader provider for the JSON and CBOR {@link JacksonSessionCodec}s.
 */
public final class JacksonSessionCodecProvider implements SessionCodecProvider {
    @Override
    public List<SessionCodec> codecs() {
        return List.of(JacksonSessionCodec.json(), JacksonSessionCodec.cbor());
    }
}
