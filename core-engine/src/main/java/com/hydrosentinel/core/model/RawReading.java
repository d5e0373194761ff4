package com.hydrosentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Untrusted reading as delivered by the transport.
 *
 * <p>
 * Nothing about the content is guaranteed: the value may be absent, a
 * string, or not a number at all, and the timestamp may be in any of the
 * accepted encodings or missing. Interpretation is left to the
 * {@link com.hydrosentinel.core.validation.ReadingValidator}.
 * </p>
 *
 * <h3>Malformed payloads</h3>
 * <p>
 * A payload that could not even be parsed is still represented as a
 * {@code RawReading} carrying a {@link #getMalformedReason() malformed
 * reason}, so that it travels through the pipeline and is counted like every
 * other rejection.
 * </p>
 *
 * @since 1.0.0
 */
public final class RawReading {

    private final String topic;
    private final String sensorId;
    private final SensorCategory category;
    private final Object rawTimestamp;
    private final Object rawValue;
    private final Double reportedQuality;
    private final Map<String, Object> metadata;
    private final Instant receivedAt;
    private final long receivedNanos;
    private final String malformedReason;

    private RawReading(Builder builder) {
        this.topic = builder.topic;
        this.sensorId = builder.sensorId;
        this.category = builder.category;
        this.rawTimestamp = builder.rawTimestamp;
        this.rawValue = builder.rawValue;
        this.reportedQuality = builder.reportedQuality;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Collections.emptyMap();
        this.receivedAt = builder.receivedAt != null ? builder.receivedAt : Instant.now();
        this.receivedNanos = builder.receivedNanos != 0L ? builder.receivedNanos : System.nanoTime();
        this.malformedReason = builder.malformedReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a reading standing in for a payload that could not be parsed.
     *
     * @param topic  topic the payload arrived on
     * @param reason why parsing failed
     * @return a reading the validator will reject as malformed
     */
    public static RawReading malformed(String topic, String reason) {
        return builder()
                .topic(topic)
                .category(SensorCategory.fromTopic(topic).orElse(SensorCategory.FLOW))
                .malformedReason(Objects.requireNonNull(reason, "reason must not be null"))
                .build();
    }

    /**
     * Fluent builder for {@link RawReading}. Every field is optional.
     */
    public static class Builder {
        private String topic;
        private String sensorId;
        private SensorCategory category = SensorCategory.FLOW;
        private Object rawTimestamp;
        private Object rawValue;
        private Double reportedQuality;
        private Map<String, Object> metadata;
        private Instant receivedAt;
        private long receivedNanos;
        private String malformedReason;

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder category(SensorCategory category) {
            this.category = category;
            return this;
        }

        public Builder rawTimestamp(Object rawTimestamp) {
            this.rawTimestamp = rawTimestamp;
            return this;
        }

        public Builder rawValue(Object rawValue) {
            this.rawValue = rawValue;
            return this;
        }

        public Builder reportedQuality(Double reportedQuality) {
            this.reportedQuality = reportedQuality;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder receivedNanos(long receivedNanos) {
            this.receivedNanos = receivedNanos;
            return this;
        }

        public Builder malformedReason(String malformedReason) {
            this.malformedReason = malformedReason;
            return this;
        }

        public RawReading build() {
            return new RawReading(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getTopic() {
        return topic;
    }

    public String getSensorId() {
        return sensorId;
    }

    public SensorCategory getCategory() {
        return category;
    }

    public Object getRawTimestamp() {
        return rawTimestamp;
    }

    public Object getRawValue() {
        return rawValue;
    }

    public Optional<Double> getReportedQuality() {
        return Optional.ofNullable(reportedQuality);
    }

    /**
     * @return unmodifiable metadata map, never {@code null}
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    /**
     * @return {@link System#nanoTime()} at receipt, used for latency accounting
     */
    public long getReceivedNanos() {
        return receivedNanos;
    }

    public Optional<String> getMalformedReason() {
        return Optional.ofNullable(malformedReason);
    }

    public boolean isMalformed() {
        return malformedReason != null;
    }

    /**
     * Key of the stream this reading belongs to. Readings without a sensor
     * id share a single placeholder stream.
     *
     * @return stream identifier, never {@code null}
     */
    public String streamId() {
        String id = sensorId != null ? sensorId : "__unknown__";
        return category.getTopicSegment() + ":" + id;
    }

    @Override
    public String toString() {
        return "RawReading{" +
                "topic='" + topic + '\'' +
                ", sensorId='" + sensorId + '\'' +
                ", category=" + category +
                ", rawTimestamp=" + rawTimestamp +
                ", rawValue=" + rawValue +
                ", reportedQuality=" + reportedQuality +
                (malformedReason != null ? ", malformed='" + malformedReason + '\'' : "") +
                '}';
    }
}
