package com.hydrosentinel.core.buffer;

import com.hydrosentinel.core.model.RawReading;

import java.util.Objects;

/**
 * A raw reading while it waits in the {@link IngestionBuffer}.
 *
 * @since 1.0.0
 */
public final class BufferEntry {

    private final RawReading reading;
    private final long enqueuedNanos;

    BufferEntry(RawReading reading, long enqueuedNanos) {
        this.reading = Objects.requireNonNull(reading, "reading must not be null");
        this.enqueuedNanos = enqueuedNanos;
    }

    public RawReading getReading() {
        return reading;
    }

    /**
     * @return {@link System#nanoTime()} at enqueue
     */
    public long getEnqueuedNanos() {
        return enqueuedNanos;
    }

    /**
     * @param nowNanos current {@link System#nanoTime()}
     * @return nanoseconds spent waiting in the buffer
     */
    public long waitedNanos(long nowNanos) {
        return nowNanos - enqueuedNanos;
    }
}
