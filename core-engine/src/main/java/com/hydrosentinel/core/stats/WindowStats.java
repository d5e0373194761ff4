package com.hydrosentinel.core.stats;

/**
 * Immutable statistics of one rolling window at a point in time.
 *
 * <p>
 * {@code stddev} is the population standard deviation of the samples
 * currently in the window. When {@code count} is below the configured
 * minimum the stats are flagged {@linkplain #isLowConfidence() low
 * confidence} and must not be used to raise anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowStats {

    private static final WindowStats EMPTY = new WindowStats(0.0, 0.0, 0, true);

    private final double mean;
    private final double stddev;
    private final int count;
    private final boolean lowConfidence;

    public WindowStats(double mean, double stddev, int count, boolean lowConfidence) {
        this.mean = mean;
        this.stddev = stddev;
        this.count = count;
        this.lowConfidence = lowConfidence;
    }

    /**
     * @return stats of a window with no samples
     */
    public static WindowStats empty() {
        return EMPTY;
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    public int getCount() {
        return count;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public String toString() {
        return String.format("WindowStats{mean=%.4f, stddev=%.4f, count=%d%s}",
                mean, stddev, count, lowConfidence ? ", lowConfidence" : "");
    }
}
