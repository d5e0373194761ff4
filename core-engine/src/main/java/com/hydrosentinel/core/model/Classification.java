package com.hydrosentinel.core.model;

/**
 * Outcome of classifying a cleaned reading.
 *
 * @since 1.0.0
 */
public enum Classification {

    NORMAL,

    ANOMALY,

    /** Excluded from window statistics and downstream optimization; audited only. */
    QUARANTINED;

    /**
     * @return {@code true} if readings with this classification may update
     *         the rolling window
     */
    public boolean feedsWindow() {
        return this != QUARANTINED;
    }
}
