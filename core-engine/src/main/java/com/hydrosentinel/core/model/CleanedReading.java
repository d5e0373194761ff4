package com.hydrosentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reading that passed validation.
 *
 * <p>
 * The value is always finite and within the physical bounds of the
 * reading's {@link SensorCategory}; per stream, timestamps never decrease.
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class CleanedReading {

    private final String sensorId;
    private final SensorCategory category;
    private final Instant timestamp;
    private final double value;
    private final boolean interpolated;
    private final boolean timestampAdjusted;
    private final double confidence;
    private final Map<String, Object> metadata;
    private final long receivedNanos;

    private CleanedReading(Builder builder) {
        this.sensorId = Objects.requireNonNull(builder.sensorId, "sensorId must not be null");
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (!Double.isFinite(builder.value)) {
            throw new IllegalArgumentException("value must be finite, got: " + builder.value);
        }
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.value = builder.value;
        this.interpolated = builder.interpolated;
        this.timestampAdjusted = builder.timestampAdjusted;
        this.confidence = builder.confidence;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Collections.emptyMap();
        this.receivedNanos = builder.receivedNanos;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CleanedReading}.
     *
     * <p>
     * {@code sensorId}, {@code category} and {@code timestamp} are required;
     * {@code value} must be finite and {@code confidence} within [0, 1].
     * </p>
     */
    public static class Builder {
        private String sensorId;
        private SensorCategory category;
        private Instant timestamp;
        private double value;
        private boolean interpolated;
        private boolean timestampAdjusted;
        private double confidence = 1.0;
        private Map<String, Object> metadata;
        private long receivedNanos;

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder category(SensorCategory category) {
            this.category = category;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder interpolated(boolean interpolated) {
            this.interpolated = interpolated;
            return this;
        }

        public Builder timestampAdjusted(boolean timestampAdjusted) {
            this.timestampAdjusted = timestampAdjusted;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder receivedNanos(long receivedNanos) {
            this.receivedNanos = receivedNanos;
            return this;
        }

        /**
         * @return a new {@link CleanedReading}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if value or confidence are illegal
         */
        public CleanedReading build() {
            return new CleanedReading(this);
        }
    }

    public String getSensorId() {
        return sensorId;
    }

    public SensorCategory getCategory() {
        return category;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return {@code true} if the value was reconstructed from window context
     */
    public boolean isInterpolated() {
        return interpolated;
    }

    /**
     * @return {@code true} if a slightly late timestamp was clamped forward
     */
    public boolean isTimestampAdjusted() {
        return timestampAdjusted;
    }

    /**
     * @return validator confidence in [0, 1]
     */
    public double getConfidence() {
        return confidence;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public long getReceivedNanos() {
        return receivedNanos;
    }

    /**
     * @return the key of the window this reading feeds
     */
    public String streamId() {
        return category.getTopicSegment() + ":" + sensorId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CleanedReading that))
            return false;
        return Double.compare(value, that.value) == 0
                && Objects.equals(sensorId, that.sensorId)
                && category == that.category
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, category, timestamp, value);
    }

    @Override
    public String toString() {
        return "CleanedReading{" +
                "sensorId='" + sensorId + '\'' +
                ", category=" + category +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", interpolated=" + interpolated +
                ", confidence=" + confidence +
                '}';
    }
}
