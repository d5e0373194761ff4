package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;

/**
 * Downstream collaborator (optimization, forecasting, storage, ledger)
 * receiving every reading classified {@code NORMAL} or {@code ANOMALY}.
 *
 * <p>
 * A thrown exception counts as a failed delivery attempt; the pipeline
 * retries a bounded number of times, then logs and moves on.
 * Implementations are called from several worker threads.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReadingConsumer {

    /**
     * @param reading the cleaned reading
     * @param verdict its classification
     * @throws Exception if delivery failed
     */
    void accept(CleanedReading reading, AnomalyVerdict verdict) throws Exception;

    /**
     * @return name used in logs
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
