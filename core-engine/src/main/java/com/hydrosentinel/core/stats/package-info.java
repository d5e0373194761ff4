/**
 * Per-stream rolling windows with incremental mean and standard deviation.
 *
 * <p>
 * {@link com.hydrosentinel.core.stats.WindowStatisticsTracker} owns every
 * {@link com.hydrosentinel.core.stats.WindowState}; the validator sees a
 * state only through the read-only
 * {@link com.hydrosentinel.core.stats.StreamContext} view.
 * </p>
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.stats;
