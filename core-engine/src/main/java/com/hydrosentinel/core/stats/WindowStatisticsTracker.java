package com.hydrosentinel.core.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link WindowState} per sensor stream.
 *
 * <p>
 * States are created on the first sample of a stream and evicted by
 * {@link #evictIdle(Instant)} once they have not been updated for the idle
 * timeout. Updates to one stream are serialized on that stream's state;
 * different streams proceed in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowStatisticsTracker {

    private static final Logger LOG = LoggerFactory.getLogger(WindowStatisticsTracker.class);

    private final int windowSize;
    private final int minSamples;
    private final Duration idleTimeout;
    private final Clock clock;
    private final Map<String, WindowState> states = new ConcurrentHashMap<>();

    /**
     * @param windowSize  samples per window; must be &gt;= 2
     * @param minSamples  samples needed before stats are trusted
     * @param idleTimeout idle time after which a stream is evicted
     * @param clock       time source
     * @throws IllegalArgumentException if {@code windowSize} &lt; 2 or
     *                                  {@code minSamples} &lt; 1
     */
    public WindowStatisticsTracker(int windowSize, int minSamples, Duration idleTimeout, Clock clock) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got: " + windowSize);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        this.windowSize = windowSize;
        this.minSamples = minSamples;
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public WindowStatisticsTracker(int windowSize, int minSamples) {
        this(windowSize, minSamples, Duration.ofHours(1), Clock.systemUTC());
    }

    /**
     * Return the live state of a stream, creating it if needed. The caller
     * must lock it and check {@link WindowState#isRetired()} before use.
     *
     * @param streamId stream identifier; must not be {@code null}
     * @return the stream's state
     */
    public WindowState acquire(String streamId) {
        Objects.requireNonNull(streamId, "streamId must not be null");
        return states.computeIfAbsent(streamId,
                id -> new WindowState(id, windowSize, minSamples, clock.instant()));
    }

    /**
     * Add a sample to a state the caller already holds the lock of.
     *
     * @param state     locked, non-retired state
     * @param timestamp sample timestamp
     * @param value     finite value
     * @return stats after the update
     */
    public WindowStats record(WindowState state, Instant timestamp, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite, got: " + value);
        }
        return state.add(timestamp, value, clock.instant());
    }

    /**
     * Add a sample to a stream.
     *
     * @param streamId  stream identifier
     * @param timestamp sample timestamp
     * @param value     finite value
     * @return stats after the update
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public WindowStats update(String streamId, Instant timestamp, double value) {
        while (true) {
            WindowState state = acquire(streamId);
            synchronized (state) {
                if (!state.isRetired()) {
                    return record(state, timestamp, value);
                }
            }
        }
    }

    /**
     * Add a sample stamped with the current time.
     *
     * @param streamId stream identifier
     * @param value    finite value
     * @return stats after the update
     */
    public WindowStats update(String streamId, double value) {
        return update(streamId, clock.instant(), value);
    }

    /**
     * @param streamId stream identifier
     * @return current stats, or {@link WindowStats#empty()} for an unknown
     *         stream
     */
    public WindowStats stats(String streamId) {
        WindowState state = states.get(streamId);
        if (state == null) {
            return WindowStats.empty();
        }
        synchronized (state) {
            return state.stats();
        }
    }

    /**
     * Evict every stream not updated within the idle timeout.
     *
     * @param now reference time
     * @return number of evicted streams
     */
    public int evictIdle(Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        int evicted = 0;
        for (WindowState state : states.values()) {
            synchronized (state) {
                if (!state.isRetired() && state.getLastUpdate().isBefore(cutoff)) {
                    state.retire();
                    states.remove(state.getStreamId(), state);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            LOG.info("Evicted {} idle stream(s) (idle > {})", evicted, idleTimeout);
        }
        return evicted;
    }

    /**
     * Evict idle streams relative to the tracker's clock.
     *
     * @return number of evicted streams
     */
    public int evictIdle() {
        return evictIdle(clock.instant());
    }

    public int streamCount() {
        return states.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }
}
