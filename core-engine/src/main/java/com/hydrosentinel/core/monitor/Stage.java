package com.hydrosentinel.core.monitor;

/**
 * Timed stages of the per-reading pipeline.
 *
 * @since 1.0.0
 */
public enum Stage {
    VALIDATION,
    CLASSIFICATION,
    WINDOW_UPDATE,
    DELIVERY,
    /** Receipt to completion, including time spent in the buffer. */
    TOTAL
}
