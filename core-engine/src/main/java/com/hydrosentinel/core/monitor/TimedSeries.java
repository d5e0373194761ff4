package com.hydrosentinel.core.monitor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free, time-ordered series of observations bounded by age and count.
 *
 * <p>
 * Writers append and prune from the head; readers take a weakly consistent
 * copy and never block writers.
 * </p>
 *
 * @param <T> observed value type
 */
final class TimedSeries<T> {

    static final class Point<T> {
        final long nanos;
        final T value;

        Point(long nanos, T value) {
            this.nanos = nanos;
            this.value = value;
        }
    }

    private final ConcurrentLinkedDeque<Point<T>> points = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int maxPoints;

    TimedSeries(int maxPoints) {
        this.maxPoints = maxPoints;
    }

    void add(long nanos, T value, long cutoffNanos) {
        points.addLast(new Point<>(nanos, value));
        size.incrementAndGet();
        prune(cutoffNanos);
    }

    void prune(long cutoffNanos) {
        while (true) {
            Point<T> head = points.peekFirst();
            if (head == null) {
                return;
            }
            boolean expired = head.nanos - cutoffNanos < 0;
            if (!expired && size.get() <= maxPoints) {
                return;
            }
            if (points.removeFirstOccurrence(head)) {
                size.decrementAndGet();
            }
        }
    }

    /**
     * @param cutoffNanos oldest timestamp to include
     * @return values observed at or after the cutoff, oldest first
     */
    List<T> since(long cutoffNanos) {
        List<T> copy = new ArrayList<>();
        for (Point<T> p : points) {
            if (p.nanos - cutoffNanos >= 0) {
                copy.add(p.value);
            }
        }
        return copy;
    }
}
