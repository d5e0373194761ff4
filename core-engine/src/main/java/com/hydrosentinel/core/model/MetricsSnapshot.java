package com.hydrosentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time aggregation of pipeline performance over a trailing period.
 *
 * <p>
 * A read model: instances are immutable and carry no behaviour. Latencies
 * are in milliseconds, occupancies in percent and rates as fractions in
 * [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsSnapshot {

    private final Instant timestamp;
    private final Duration period;
    private final String pipelineState;
    private final long processedCount;
    private final double meanLatencyMs;
    private final double p95LatencyMs;
    private final double maxLatencyMs;
    private final Map<String, Double> stageMeanLatencyMs;
    private final double currentBufferOccupancyPct;
    private final double maxBufferOccupancyPct;
    private final double meanBufferOccupancyPct;
    private final double errorRate;
    private final double anomalyRate;
    private final double quarantineRate;
    private final long droppedCount;
    private final long deliveryFailureCount;
    private final int trackedStreams;

    private MetricsSnapshot(Builder b) {
        this.timestamp = b.timestamp;
        this.period = b.period;
        this.pipelineState = b.pipelineState;
        this.processedCount = b.processedCount;
        this.meanLatencyMs = b.meanLatencyMs;
        this.p95LatencyMs = b.p95LatencyMs;
        this.maxLatencyMs = b.maxLatencyMs;
        this.stageMeanLatencyMs = Collections.unmodifiableMap(b.stageMeanLatencyMs);
        this.currentBufferOccupancyPct = b.currentBufferOccupancyPct;
        this.maxBufferOccupancyPct = b.maxBufferOccupancyPct;
        this.meanBufferOccupancyPct = b.meanBufferOccupancyPct;
        this.errorRate = b.errorRate;
        this.anomalyRate = b.anomalyRate;
        this.quarantineRate = b.quarantineRate;
        this.droppedCount = b.droppedCount;
        this.deliveryFailureCount = b.deliveryFailureCount;
        this.trackedStreams = b.trackedStreams;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this snapshot with pipeline-level fields filled in.
     *
     * @param state          current pipeline state name
     * @param trackedStreams number of live window states
     * @return a new snapshot
     */
    public MetricsSnapshot withPipeline(String state, int trackedStreams) {
        Builder b = toBuilder();
        b.pipelineState = state;
        b.trackedStreams = trackedStreams;
        return b.build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.timestamp = timestamp;
        b.period = period;
        b.pipelineState = pipelineState;
        b.processedCount = processedCount;
        b.meanLatencyMs = meanLatencyMs;
        b.p95LatencyMs = p95LatencyMs;
        b.maxLatencyMs = maxLatencyMs;
        b.stageMeanLatencyMs = new LinkedHashMap<>(stageMeanLatencyMs);
        b.currentBufferOccupancyPct = currentBufferOccupancyPct;
        b.maxBufferOccupancyPct = maxBufferOccupancyPct;
        b.meanBufferOccupancyPct = meanBufferOccupancyPct;
        b.errorRate = errorRate;
        b.anomalyRate = anomalyRate;
        b.quarantineRate = quarantineRate;
        b.droppedCount = droppedCount;
        b.deliveryFailureCount = deliveryFailureCount;
        b.trackedStreams = trackedStreams;
        return b;
    }

    public static class Builder {
        private Instant timestamp = Instant.now();
        private Duration period = Duration.ZERO;
        private String pipelineState = "UNKNOWN";
        private long processedCount;
        private double meanLatencyMs;
        private double p95LatencyMs;
        private double maxLatencyMs;
        private Map<String, Double> stageMeanLatencyMs = new LinkedHashMap<>();
        private double currentBufferOccupancyPct;
        private double maxBufferOccupancyPct;
        private double meanBufferOccupancyPct;
        private double errorRate;
        private double anomalyRate;
        private double quarantineRate;
        private long droppedCount;
        private long deliveryFailureCount;
        private int trackedStreams;

        public Builder timestamp(Instant v) {
            this.timestamp = v;
            return this;
        }

        public Builder period(Duration v) {
            this.period = v;
            return this;
        }

        public Builder processedCount(long v) {
            this.processedCount = v;
            return this;
        }

        public Builder meanLatencyMs(double v) {
            this.meanLatencyMs = v;
            return this;
        }

        public Builder p95LatencyMs(double v) {
            this.p95LatencyMs = v;
            return this;
        }

        public Builder maxLatencyMs(double v) {
            this.maxLatencyMs = v;
            return this;
        }

        public <E extends Enum<E>> Builder stageMeanLatencyMs(EnumMap<E, Double> v) {
            this.stageMeanLatencyMs = new LinkedHashMap<>();
            v.forEach((stage, ms) -> stageMeanLatencyMs.put(stage.name(), ms));
            return this;
        }

        public Builder currentBufferOccupancyPct(double v) {
            this.currentBufferOccupancyPct = v;
            return this;
        }

        public Builder maxBufferOccupancyPct(double v) {
            this.maxBufferOccupancyPct = v;
            return this;
        }

        public Builder meanBufferOccupancyPct(double v) {
            this.meanBufferOccupancyPct = v;
            return this;
        }

        public Builder errorRate(double v) {
            this.errorRate = v;
            return this;
        }

        public Builder anomalyRate(double v) {
            this.anomalyRate = v;
            return this;
        }

        public Builder quarantineRate(double v) {
            this.quarantineRate = v;
            return this;
        }

        public Builder droppedCount(long v) {
            this.droppedCount = v;
            return this;
        }

        public Builder deliveryFailureCount(long v) {
            this.deliveryFailureCount = v;
            return this;
        }

        public MetricsSnapshot build() {
            return new MetricsSnapshot(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters (read by Jackson)
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public Duration getPeriod() {
        return period;
    }

    public String getPipelineState() {
        return pipelineState;
    }

    public long getProcessedCount() {
        return processedCount;
    }

    public double getMeanLatencyMs() {
        return meanLatencyMs;
    }

    public double getP95LatencyMs() {
        return p95LatencyMs;
    }

    public double getMaxLatencyMs() {
        return maxLatencyMs;
    }

    public Map<String, Double> getStageMeanLatencyMs() {
        return stageMeanLatencyMs;
    }

    public double getCurrentBufferOccupancyPct() {
        return currentBufferOccupancyPct;
    }

    public double getMaxBufferOccupancyPct() {
        return maxBufferOccupancyPct;
    }

    public double getMeanBufferOccupancyPct() {
        return meanBufferOccupancyPct;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public double getAnomalyRate() {
        return anomalyRate;
    }

    public double getQuarantineRate() {
        return quarantineRate;
    }

    public long getDroppedCount() {
        return droppedCount;
    }

    public long getDeliveryFailureCount() {
        return deliveryFailureCount;
    }

    public int getTrackedStreams() {
        return trackedStreams;
    }

    @Override
    public String toString() {
        return String.format(
                "MetricsSnapshot{state=%s, processed=%d, latency(mean=%.2fms, p95=%.2fms, max=%.2fms), "
                        + "buffer=%.1f%%, errorRate=%.2f%%, anomalyRate=%.2f%%, dropped=%d, streams=%d}",
                pipelineState, processedCount, meanLatencyMs, p95LatencyMs, maxLatencyMs,
                currentBufferOccupancyPct, errorRate * 100, anomalyRate * 100, droppedCount, trackedStreams);
    }
}
