package io.sessionstore.core;

import java.util.List;

/**
 * ServiceLoader hook for contributing {@link SessionCodec}s.
 *
 * <p>Register implementations in {@code META-INF/services/io.sessionstore.core.SessionCodecProvider}.
 */
public interface SessionCodecProvider {

    List<SessionCodec> codecs();
}
