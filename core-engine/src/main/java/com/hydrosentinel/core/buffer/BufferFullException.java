package com.hydrosentinel.core.buffer;

/**
 * Thrown when a reading cannot be enqueued because the buffer is at
 * capacity. The producer decides whether to drop the reading or push back
 * upstream.
 *
 * @since 1.0.0
 */
public class BufferFullException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int capacity;

    public BufferFullException(int capacity) {
        super("Ingestion buffer full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
