package com.hydrosentinel.core.config;

import java.util.List;

/**
 * Thresholds evaluated by the
 * {@link com.hydrosentinel.core.monitor.PerformanceMonitor}.
 *
 * <p>
 * Latencies are in milliseconds, error rates are fractions and buffer
 * occupancies are percentages. Defaults follow the operating targets of the
 * water telemetry deployment: 120 ms mean processing time, 200 ms p95, hard
 * alert above 250 ms; error rate below 1%, warning at 2%, critical at 5%.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertThresholds {

    private double latencyTargetMs = 120;
    private double latencyP95WarningMs = 200;
    private double latencyAlertMs = 250;

    private double errorRateTarget = 0.01;
    private double errorRateWarning = 0.02;
    private double errorRateCritical = 0.05;

    private double bufferWarningPct = 80;
    private double bufferCriticalPct = 95;

    /** Trailing window the aggregates cover. */
    private long monitorWindowMs = 300_000;

    /** Minimum gap between two alerts on the same metric. */
    private long alertCooldownMs = 5_000;

    /** Upper bound on retained samples per series inside the trailing window. */
    private int maxSamples = 100_000;

    /**
     * Collect validation problems into {@code errors}.
     *
     * @param errors sink for error messages
     */
    void validateInto(List<String> errors) {
        if (latencyTargetMs <= 0 || latencyP95WarningMs <= 0 || latencyAlertMs <= 0) {
            errors.add("Latency thresholds must be > 0");
        }
        if (latencyP95WarningMs > latencyAlertMs) {
            errors.add("latencyP95WarningMs must not exceed latencyAlertMs");
        }
        if (errorRateWarning < 0 || errorRateCritical > 1 || errorRateWarning > errorRateCritical) {
            errors.add("Error-rate thresholds must satisfy 0 <= warning <= critical <= 1");
        }
        if (bufferWarningPct < 0 || bufferCriticalPct > 100 || bufferWarningPct > bufferCriticalPct) {
            errors.add("Buffer thresholds must satisfy 0 <= warning <= critical <= 100");
        }
        if (monitorWindowMs <= 0) {
            errors.add("monitorWindowMs must be > 0");
        }
        if (alertCooldownMs < 0) {
            errors.add("alertCooldownMs must be >= 0");
        }
        if (maxSamples < 1) {
            errors.add("maxSamples must be >= 1");
        }
    }

    public double getLatencyTargetMs() {
        return latencyTargetMs;
    }

    public void setLatencyTargetMs(double latencyTargetMs) {
        this.latencyTargetMs = latencyTargetMs;
    }

    public double getLatencyP95WarningMs() {
        return latencyP95WarningMs;
    }

    public void setLatencyP95WarningMs(double latencyP95WarningMs) {
        this.latencyP95WarningMs = latencyP95WarningMs;
    }

    public double getLatencyAlertMs() {
        return latencyAlertMs;
    }

    public void setLatencyAlertMs(double latencyAlertMs) {
        this.latencyAlertMs = latencyAlertMs;
    }

    public double getErrorRateTarget() {
        return errorRateTarget;
    }

    public void setErrorRateTarget(double errorRateTarget) {
        this.errorRateTarget = errorRateTarget;
    }

    public double getErrorRateWarning() {
        return errorRateWarning;
    }

    public void setErrorRateWarning(double errorRateWarning) {
        this.errorRateWarning = errorRateWarning;
    }

    public double getErrorRateCritical() {
        return errorRateCritical;
    }

    public void setErrorRateCritical(double errorRateCritical) {
        this.errorRateCritical = errorRateCritical;
    }

    public double getBufferWarningPct() {
        return bufferWarningPct;
    }

    public void setBufferWarningPct(double bufferWarningPct) {
        this.bufferWarningPct = bufferWarningPct;
    }

    public double getBufferCriticalPct() {
        return bufferCriticalPct;
    }

    public void setBufferCriticalPct(double bufferCriticalPct) {
        this.bufferCriticalPct = bufferCriticalPct;
    }

    public long getMonitorWindowMs() {
        return monitorWindowMs;
    }

    public void setMonitorWindowMs(long monitorWindowMs) {
        this.monitorWindowMs = monitorWindowMs;
    }

    public long getAlertCooldownMs() {
        return alertCooldownMs;
    }

    public void setAlertCooldownMs(long alertCooldownMs) {
        this.alertCooldownMs = alertCooldownMs;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    @Override
    public String toString() {
        return "AlertThresholds{" +
                "latency=" + latencyTargetMs + "/" + latencyP95WarningMs + "/" + latencyAlertMs + "ms" +
                ", errorRate=" + errorRateWarning + "/" + errorRateCritical +
                ", buffer=" + bufferWarningPct + "/" + bufferCriticalPct + "%" +
                ", window=" + monitorWindowMs + "ms" +
                '}';
    }
}
