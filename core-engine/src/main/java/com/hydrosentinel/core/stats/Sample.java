package com.hydrosentinel.core.stats;

import java.time.Instant;

/**
 * One {@code (timestamp, value)} pair held in a rolling window.
 *
 * @since 1.0.0
 */
public final class Sample {

    private final Instant timestamp;
    private final double value;

    public Sample(Instant timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value + "@" + timestamp;
    }
}
