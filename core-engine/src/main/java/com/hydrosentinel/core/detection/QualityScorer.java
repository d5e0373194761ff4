package com.hydrosentinel.core.detection;

import com.hydrosentinel.core.model.CleanedReading;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Derives a reading's quality score from validator confidence and recency.
 *
 * <p>
 * The recency factor is {@code 1} while the reading is at most
 * {@code stalenessHorizon} old, then falls linearly to {@code 0} at twice
 * the horizon. Readings stamped in the future count as fresh.
 * </p>
 *
 * @since 1.0.0
 */
public class QualityScorer {

    private final Duration stalenessHorizon;
    private final Clock clock;

    /**
     * @param stalenessHorizon age up to which a reading counts as fresh; must be
     *                         positive
     * @param clock            time source
     * @throws IllegalArgumentException if {@code stalenessHorizon} is not positive
     */
    public QualityScorer(Duration stalenessHorizon, Clock clock) {
        Objects.requireNonNull(stalenessHorizon, "stalenessHorizon must not be null");
        if (stalenessHorizon.isZero() || stalenessHorizon.isNegative()) {
            throw new IllegalArgumentException("stalenessHorizon must be positive, got: " + stalenessHorizon);
        }
        this.stalenessHorizon = stalenessHorizon;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param reading cleaned reading
     * @return quality score in [0, 1]
     */
    public double score(CleanedReading reading) {
        return reading.getConfidence() * recency(reading);
    }

    double recency(CleanedReading reading) {
        Duration age = Duration.between(reading.getTimestamp(), clock.instant());
        if (age.compareTo(stalenessHorizon) <= 0) {
            return 1.0;
        }
        double overdue = (double) age.minus(stalenessHorizon).toMillis() / stalenessHorizon.toMillis();
        return Math.max(0.0, 1.0 - overdue);
    }
}
