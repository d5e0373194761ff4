package com.hydrosentinel.core.stats;

import java.time.Instant;
import java.util.Optional;

/**
 * Rolling window of the last {@code capacity} samples of one sensor stream.
 *
 * <h3>Implementation</h3>
 * <p>
 * Samples live in a ring buffer. Mean and the sum of squared deviations
 * ({@code m2}) are maintained with Welford's online update on insertion and
 * its inverse on eviction, so each update is O(1). After {@code capacity}
 * evictions the aggregates are recomputed exactly from the ring to bound
 * floating-point drift, which keeps the amortized cost O(1).
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe on its own. The instance is its own lock: every caller
 * must hold {@code synchronized (state)} while reading or mutating it, and
 * must re-resolve the state from the tracker if {@link #isRetired()} is
 * {@code true} after acquiring the lock.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowState implements StreamContext {

    private final String streamId;
    private final int capacity;
    private final int minSamples;

    private final double[] values;
    private final Instant[] timestamps;
    private int head;
    private int count;

    private double mean;
    private double m2;
    private int evictionsSinceRecompute;

    /** Ordering watermark; not part of the statistical window. */
    private Instant lastAccepted;
    private Instant lastUpdate;
    private boolean retired;

    WindowState(String streamId, int capacity, int minSamples, Instant createdAt) {
        this.streamId = streamId;
        this.capacity = capacity;
        this.minSamples = minSamples;
        this.values = new double[capacity];
        this.timestamps = new Instant[capacity];
        this.lastUpdate = createdAt;
    }

    /**
     * Add a sample, evicting the oldest one if the window is full.
     *
     * @param timestamp sample timestamp
     * @param value     finite sample value
     * @param now       wall-clock time of the update, used for idle eviction
     * @return stats after the update
     */
    WindowStats add(Instant timestamp, double value, Instant now) {
        if (count == capacity) {
            evictOldest();
        }
        int tail = (head + count) % capacity;
        values[tail] = value;
        timestamps[tail] = timestamp;
        count++;

        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);

        if (evictionsSinceRecompute >= capacity) {
            recompute();
        }
        lastUpdate = now;
        return stats();
    }

    private void evictOldest() {
        double old = values[head];
        timestamps[head] = null;
        head = (head + 1) % capacity;
        count--;
        if (count == 0) {
            mean = 0.0;
            m2 = 0.0;
        } else {
            double delta = old - mean;
            mean -= delta / count;
            m2 -= delta * (old - mean);
            if (m2 < 0.0) {
                m2 = 0.0;
            }
        }
        evictionsSinceRecompute++;
    }

    private void recompute() {
        double sum = 0.0;
        for (int i = 0; i < count; i++) {
            sum += values[(head + i) % capacity];
        }
        mean = sum / count;
        double squares = 0.0;
        for (int i = 0; i < count; i++) {
            double d = values[(head + i) % capacity] - mean;
            squares += d * d;
        }
        m2 = squares;
        evictionsSinceRecompute = 0;
    }

    /**
     * @return current stats without mutating the window
     */
    public WindowStats stats() {
        if (count == 0) {
            return WindowStats.empty();
        }
        double stddev = Math.sqrt(Math.max(0.0, m2 / count));
        return new WindowStats(mean, stddev, count, count < minSamples);
    }

    /**
     * Advance the ordering watermark after a reading has been accepted.
     *
     * @param timestamp the accepted reading's timestamp
     */
    public void markAccepted(Instant timestamp) {
        if (lastAccepted == null || timestamp.isAfter(lastAccepted)) {
            lastAccepted = timestamp;
        }
    }

    // ---------------------------------------------------------------
    // StreamContext
    // ---------------------------------------------------------------

    @Override
    public int sampleCount() {
        return count;
    }

    @Override
    public Optional<Sample> recentSample(int age) {
        if (age < 0 || age >= count) {
            return Optional.empty();
        }
        int index = (head + count - 1 - age) % capacity;
        return Optional.of(new Sample(timestamps[index], values[index]));
    }

    @Override
    public Optional<Instant> lastAcceptedTimestamp() {
        return Optional.ofNullable(lastAccepted);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public String getStreamId() {
        return streamId;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    /**
     * @return {@code true} once the tracker has evicted this state
     */
    public boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    @Override
    public String toString() {
        return "WindowState{" + streamId + ", " + stats() + '}';
    }
}
