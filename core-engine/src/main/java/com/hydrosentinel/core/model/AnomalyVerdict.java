package com.hydrosentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of classifying one {@link CleanedReading}.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code reading}, {@code classification} and
 * {@code evaluatedAt} are required; severity defaults to
 * {@link Severity#NONE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyVerdict {

    private final CleanedReading reading;
    private final double zScore;
    private final double qualityScore;
    private final Classification classification;
    private final Severity severity;
    private final boolean lowConfidence;
    private final Instant evaluatedAt;

    private AnomalyVerdict(Builder builder) {
        this.reading = Objects.requireNonNull(builder.reading, "reading must not be null");
        this.classification = Objects.requireNonNull(builder.classification, "classification must not be null");
        this.evaluatedAt = Objects.requireNonNull(builder.evaluatedAt, "evaluatedAt must not be null");
        this.severity = builder.severity != null ? builder.severity : Severity.NONE;
        this.zScore = builder.zScore;
        this.qualityScore = builder.qualityScore;
        this.lowConfidence = builder.lowConfidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CleanedReading reading;
        private double zScore;
        private double qualityScore;
        private Classification classification;
        private Severity severity;
        private boolean lowConfidence;
        private Instant evaluatedAt;

        public Builder reading(CleanedReading reading) {
            this.reading = reading;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder qualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder classification(Classification classification) {
            this.classification = classification;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder lowConfidence(boolean lowConfidence) {
            this.lowConfidence = lowConfidence;
            return this;
        }

        public Builder evaluatedAt(Instant evaluatedAt) {
            this.evaluatedAt = evaluatedAt;
            return this;
        }

        /**
         * @return a new {@link AnomalyVerdict}
         * @throws NullPointerException if a required field is missing
         */
        public AnomalyVerdict build() {
            return new AnomalyVerdict(this);
        }
    }

    public CleanedReading getReading() {
        return reading;
    }

    public double getZScore() {
        return zScore;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public Classification getClassification() {
        return classification;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return {@code true} if the window had too few samples for the z-score
     *         to be trusted
     */
    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public boolean isAnomaly() {
        return classification == Classification.ANOMALY;
    }

    @Override
    public String toString() {
        return "AnomalyVerdict{" +
                "sensorId='" + reading.getSensorId() + '\'' +
                ", value=" + reading.getValue() +
                ", zScore=" + String.format("%.3f", zScore) +
                ", qualityScore=" + String.format("%.3f", qualityScore) +
                ", classification=" + classification +
                ", severity=" + severity +
                (lowConfidence ? ", lowConfidence" : "") +
                '}';
    }
}
