package com.hydrosentinel.core.config;

/**
 * What the producer does when the ingestion buffer is full.
 *
 * @since 1.0.0
 */
public enum BackpressurePolicy {

    /** Fail immediately; the reading is dropped and counted. */
    DROP,

    /** Wait up to {@code enqueueTimeoutMs} for space, then drop and count. */
    BOUNDED_WAIT
}
