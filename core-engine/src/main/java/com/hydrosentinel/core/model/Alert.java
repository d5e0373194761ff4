package com.hydrosentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Advisory alert raised when a monitored metric crosses a threshold.
 *
 * <p>
 * Serialized to JSON and handed to the configured
 * {@link com.hydrosentinel.core.pipeline.AlertSink}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code metric}, {@code severity} and {@code timestamp} are present; omitting
 * any of them will throw a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert {

    /** Name of the metric that crossed its threshold, e.g. {@code error.rate}. */
    private final String metric;

    /** {@link Severity#WARNING} or {@link Severity#CRITICAL}. */
    private final Severity severity;

    /** Value observed when the threshold check ran. */
    private final double observedValue;

    /** Threshold that was crossed. */
    private final double threshold;

    /** Time of the threshold check. */
    private final Instant timestamp;

    /** Human-readable description of what was detected. */
    private final String details;

    private Alert(Builder builder) {
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (severity == Severity.NONE) {
            throw new IllegalArgumentException("An alert must carry WARNING or CRITICAL severity");
        }
        this.observedValue = builder.observedValue;
        this.threshold = builder.threshold;
        this.details = builder.details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     *
     * <p>
     * {@code metric}, {@code severity} and {@code timestamp} are
     * <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private String metric;
        private Severity severity;
        private double observedValue;
        private double threshold;
        private Instant timestamp;
        private String details;

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException     if {@code metric}, {@code severity} or
         *                                  {@code timestamp} is {@code null}
         * @throws IllegalArgumentException if severity is {@link Severity#NONE}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters (read by Jackson)
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public double getThreshold() {
        return threshold;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDetails() {
        return details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(metric, alert.metric)
                && severity == alert.severity
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, severity, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "metric='" + metric + '\'' +
                ", severity=" + severity +
                ", observedValue=" + observedValue +
                ", threshold=" + threshold +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}
