package com.hydrosentinel.core.detection;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.stats.WindowStats;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: everything they need about
 * the stream's history arrives in the {@link WindowStats} argument, which
 * the pipeline takes from the stream's window <em>before</em> the reading
 * itself is added, so a value never influences its own evaluation.
 * </p>
 * <p>
 * Implementations must be safe to call from several worker threads at once.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Classify a single cleaned reading.
     *
     * @param reading the reading to classify
     * @param stats   stats of the reading's stream window
     * @return the verdict; never {@code null}
     */
    AnomalyVerdict classify(CleanedReading reading, WindowStats stats);

    /**
     * Return a short name identifying the detection strategy, used in logs.
     *
     * @return detector name
     */
    String getName();
}
