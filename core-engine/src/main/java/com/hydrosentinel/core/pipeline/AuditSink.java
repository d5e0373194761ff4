package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.Rejection;

/**
 * Audit trail for readings kept out of the statistics and out of
 * downstream optimization.
 *
 * @since 1.0.0
 */
public interface AuditSink {

    /**
     * @param reading the quarantined reading
     * @param verdict its verdict, carrying the quality score
     */
    void quarantined(CleanedReading reading, AnomalyVerdict verdict);

    /**
     * @param rejection a reading refused by the validator
     */
    void rejected(Rejection rejection);
}
