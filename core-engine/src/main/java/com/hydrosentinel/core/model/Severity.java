package com.hydrosentinel.core.model;

/**
 * Severity attached to anomaly verdicts and monitor alerts.
 *
 * @since 1.0.0
 */
public enum Severity {
    NONE,
    WARNING,
    CRITICAL
}
