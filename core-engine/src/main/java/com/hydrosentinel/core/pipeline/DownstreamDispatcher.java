package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.monitor.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Delivers classified readings to every {@link ReadingConsumer} with
 * bounded retries.
 *
 * <p>
 * Attempt {@code n} is preceded by a pause of {@code n - 1} times the
 * backoff. A consumer that still fails after the last attempt is logged and
 * counted as a delivery failure; other consumers and later readings are not
 * affected.
 * </p>
 *
 * @since 1.0.0
 */
public class DownstreamDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(DownstreamDispatcher.class);

    private final List<ReadingConsumer> consumers;
    private final int attempts;
    private final Duration backoff;
    private final PerformanceMonitor monitor;

    /**
     * @param consumers downstream consumers; may be empty
     * @param attempts  attempts per consumer; must be &gt;= 1
     * @param backoff   pause unit between attempts
     * @param monitor   receives delivery-failure counts
     * @throws IllegalArgumentException if {@code attempts} &lt; 1
     */
    public DownstreamDispatcher(List<ReadingConsumer> consumers, int attempts, Duration backoff,
            PerformanceMonitor monitor) {
        Objects.requireNonNull(consumers, "consumers must not be null");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got: " + attempts);
        }
        this.consumers = Collections.unmodifiableList(new ArrayList<>(consumers));
        this.attempts = attempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
    }

    /**
     * Deliver one reading to every consumer.
     *
     * @param reading cleaned reading
     * @param verdict its classification
     * @return number of consumers that could not be reached
     */
    public int deliver(CleanedReading reading, AnomalyVerdict verdict) {
        int failed = 0;
        for (ReadingConsumer consumer : consumers) {
            if (!deliverTo(consumer, reading, verdict)) {
                failed++;
                monitor.recordDeliveryFailure();
            }
        }
        return failed;
    }

    private boolean deliverTo(ReadingConsumer consumer, CleanedReading reading, AnomalyVerdict verdict) {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                consumer.accept(reading, verdict);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while delivering to [{}] – dropping", consumer.getName());
                return false;
            } catch (Exception e) {
                if (attempt == attempts) {
                    LOG.error("Delivery to [{}] failed after {} attempt(s) for sensor [{}] – dropping",
                            consumer.getName(), attempts, reading.getSensorId(), e);
                    return false;
                }
                LOG.debug("Delivery to [{}] failed (attempt {}/{}): {}",
                        consumer.getName(), attempt, attempts, e.getMessage());
                if (!pause(attempt)) {
                    LOG.warn("Interrupted while retrying delivery to [{}] – dropping", consumer.getName());
                    return false;
                }
            }
        }
        return false;
    }

    private boolean pause(int attempt) {
        try {
            Thread.sleep(backoff.multipliedBy(attempt).toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int consumerCount() {
        return consumers.size();
    }
}
