package com.hydrosentinel.core.buffer;

/**
 * Fill-level band of the ingestion buffer.
 *
 * @since 1.0.0
 */
public enum OccupancyLevel {

    NORMAL,

    /** At or above 80% occupancy. */
    WARNING,

    /** At or above 95% occupancy. */
    CRITICAL;

    static final double WARNING_PCT = 80.0;
    static final double CRITICAL_PCT = 95.0;

    /**
     * @param occupancyPct occupancy in percent
     * @return the band the occupancy falls into
     */
    public static OccupancyLevel of(double occupancyPct) {
        if (occupancyPct >= CRITICAL_PCT) {
            return CRITICAL;
        }
        if (occupancyPct >= WARNING_PCT) {
            return WARNING;
        }
        return NORMAL;
    }
}
