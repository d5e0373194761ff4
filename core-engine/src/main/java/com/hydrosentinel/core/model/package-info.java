/**
 * Domain model classes for Hydro Sentinel.
 *
 * <p>
 * A reading moves through three shapes:
 * </p>
 * <ul>
 * <li>{@link com.hydrosentinel.core.model.RawReading} — untrusted, as parsed
 * from the transport payload</li>
 * <li>{@link com.hydrosentinel.core.model.CleanedReading} — validated, finite
 * and in range</li>
 * <li>{@link com.hydrosentinel.core.model.AnomalyVerdict} — the classified
 * result handed downstream</li>
 * </ul>
 * <p>
 * {@link com.hydrosentinel.core.model.Alert} and
 * {@link com.hydrosentinel.core.model.MetricsSnapshot} belong to the
 * performance-monitoring side.
 * </p>
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.model;
