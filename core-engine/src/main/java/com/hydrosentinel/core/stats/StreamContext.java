package com.hydrosentinel.core.stats;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only view of a stream's recent history, used by the validator to
 * interpolate missing values and enforce timestamp ordering.
 *
 * @since 1.0.0
 */
public interface StreamContext {

    /**
     * @return number of samples currently in the window
     */
    int sampleCount();

    /**
     * @param age {@code 0} for the newest sample, {@code 1} for the one
     *            before it, and so on
     * @return the sample, or empty if the window holds fewer samples
     */
    Optional<Sample> recentSample(int age);

    /**
     * @return timestamp of the last reading accepted on this stream, whether
     *         or not it entered the window
     */
    Optional<Instant> lastAcceptedTimestamp();

    /**
     * Context of a stream that has never been seen.
     *
     * @return an empty context
     */
    static StreamContext empty() {
        return EmptyStreamContext.INSTANCE;
    }
}
