package com.hydrosentinel.core.monitor;

/**
 * Terminal outcome of one reading.
 *
 * @since 1.0.0
 */
public enum Outcome {

    NORMAL,

    ANOMALY,

    QUARANTINED,

    /** Refused by the validator. Counts toward the error rate. */
    REJECTED,

    /** Unexpected failure while processing. Counts toward the error rate. */
    ERROR,

    /** Never processed: buffer full, pipeline not running, or left over after the drain timeout. */
    DROPPED;

    /**
     * @return {@code true} if the outcome counts toward the error rate
     */
    public boolean isError() {
        return this == REJECTED || this == ERROR;
    }

    /**
     * @return {@code true} if the reading went through the pipeline
     */
    public boolean isProcessed() {
        return this != DROPPED;
    }
}
