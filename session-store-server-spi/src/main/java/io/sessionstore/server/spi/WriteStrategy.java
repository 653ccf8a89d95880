package io.sessionstore.server.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Placement policy for a field written through a layered store.
 *
 * <p>Single-layer stores ignore it, except that a cold store persists {@link #hotCacheTtlSeconds()} next to
 * the field so that later warm-ups of the hot layer honour the same policy.
 *
 * <p>The interface is open; the four shipped placements are available from the static factories.
 */
public interface WriteStrategy {

    /**
     * Whether the cold layer receives the write.
     */
    boolean writesCold();

    /**
     * Whether the hot layer receives the write.
     */
    boolean writesHot();

    /**
     * Cap for the hot copy of the field in seconds: {@code null} mirrors the cold lifetime, {@code 0} never
     * caches the field hot, a positive value bounds the hot lifetime.
     */
    Long hotCacheTtlSeconds();

    static WriteStrategy writeThrough() {
        return Placement.WRITE_THROUGH;
    }

    static WriteStrategy hotOnly() {
        return Placement.HOT_ONLY;
    }

    static WriteStrategy coldOnly() {
        return Placement.COLD_ONLY;
    }

    static WriteStrategy cappedHot(Duration hotTtl) {
        Objects.requireNonNull(hotTtl, "hotTtl");
        if (hotTtl.isNegative() || hotTtl.isZero()) {
            throw new IllegalArgumentException("hotTtl must be positive");
        }
        return new CappedHot(FieldWrite.seconds(hotTtl));
    }

    /**
     * Fixed placements without parameters.
     */
    enum Placement implements WriteStrategy {
        WRITE_THROUGH(true, true, null),
        HOT_ONLY(false, true, null),
        COLD_ONLY(true, false, 0L);

        private final boolean cold;
        private final boolean hot;
        private final Long hotCacheTtlSeconds;

        Placement(boolean cold, boolean hot, Long hotCacheTtlSeconds) {
            this.cold = cold;
            this.hot = hot;
            this.hotCacheTtlSeconds = hotCacheTtlSeconds;
        }

        @Override
        public boolean writesCold() {
            return cold;
        }

        @Override
        public boolean writesHot() {
            return hot;
        }

        @Override
        public Long hotCacheTtlSeconds() {
            return hotCacheTtlSeconds;
        }
    }

    /**
     * Writes both layers, keeping the hot copy for at most {@code seconds}.
     */
    record CappedHot(long seconds) implements WriteStrategy {

        public CappedHot {
            if (seconds <= 0) {
                throw new IllegalArgumentException("seconds must be positive");
            }
        }

        @Override
        public boolean writesCold() {
            return true;
        }

        @Override
        public boolean writesHot() {
            return true;
        }

        @Override
        public Long hotCacheTtlSeconds() {
            return seconds;
        }
    }
}
