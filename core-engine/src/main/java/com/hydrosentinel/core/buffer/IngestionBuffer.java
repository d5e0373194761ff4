package com.hydrosentinel.core.buffer;

import com.hydrosentinel.core.model.RawReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO between the transport callback and the pipeline workers.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All operations are guarded by a single {@link ReentrantLock}; consumers
 * wait on {@code notEmpty}, bounded producers on {@code notFull}. The buffer
 * is the only structure shared between the producer and the workers.
 * </p>
 *
 * <h3>Closing</h3>
 * <p>
 * After {@link #close()} no new readings are accepted, but queued readings
 * remain available to {@link #dequeue()} so the pipeline can drain.
 * {@code dequeue()} returns {@code null} once the buffer is both closed and
 * empty, which is the signal for a worker to exit.
 * </p>
 *
 * <p>
 * The buffer reports its fill level through {@link #occupancyPercent()} and
 * {@link #occupancyLevel()}; it never raises alerts itself.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestionBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionBuffer.class);

    private final int capacity;
    private final ArrayDeque<BufferEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private volatile boolean closed;

    /**
     * @param capacity maximum number of queued readings; must be &gt;= 1
     * @throws IllegalArgumentException if {@code capacity} is below 1
     */
    public IngestionBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    // ---------------------------------------------------------------
    // Producer side
    // ---------------------------------------------------------------

    /**
     * Enqueue without waiting.
     *
     * @param reading the reading; must not be {@code null}
     * @throws BufferFullException   if the buffer is at capacity
     * @throws IllegalStateException if the buffer has been closed
     */
    public void enqueue(RawReading reading) {
        Objects.requireNonNull(reading, "reading must not be null");
        lock.lock();
        try {
            ensureOpen();
            if (entries.size() >= capacity) {
                throw new BufferFullException(capacity);
            }
            append(reading);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueue, waiting at most {@code timeout} for space.
     *
     * @param reading the reading; must not be {@code null}
     * @param timeout upper bound on the wait
     * @throws BufferFullException   if no space became available in time
     * @throws IllegalStateException if the buffer is or becomes closed
     * @throws InterruptedException  if the calling thread is interrupted
     */
    public void offer(RawReading reading, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(reading, "reading must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            ensureOpen();
            while (entries.size() >= capacity) {
                if (remaining <= 0L) {
                    throw new BufferFullException(capacity);
                }
                remaining = notFull.awaitNanos(remaining);
                ensureOpen();
            }
            append(reading);
        } finally {
            lock.unlock();
        }
    }

    private void append(RawReading reading) {
        entries.addLast(new BufferEntry(reading, System.nanoTime()));
        notEmpty.signal();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Ingestion buffer is closed");
        }
    }

    // ---------------------------------------------------------------
    // Consumer side
    // ---------------------------------------------------------------

    /**
     * Remove the oldest entry, blocking until one is available.
     *
     * @return the oldest entry, or {@code null} once the buffer is closed and
     *         empty
     * @throws InterruptedException if the calling thread is interrupted
     */
    public BufferEntry dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            BufferEntry entry = entries.pollFirst();
            notFull.signal();
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop accepting readings and wake every blocked producer and consumer.
     * Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                closed = true;
                LOG.debug("Ingestion buffer closed with {} entry(ies) queued", entries.size());
            }
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every queued entry, oldest first.
     *
     * @return the removed entries; empty if none
     */
    public List<BufferEntry> drainRemaining() {
        lock.lock();
        try {
            List<BufferEntry> drained = new ArrayList<>(entries);
            entries.clear();
            notFull.signalAll();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return occupancy in percent, {@code 100.0} when full
     */
    public double occupancyPercent() {
        return size() * 100.0 / capacity;
    }

    /**
     * @return the fill-level band for the current occupancy
     */
    public OccupancyLevel occupancyLevel() {
        return OccupancyLevel.of(occupancyPercent());
    }
}
