package com.hydrosentinel.core.config;

import com.hydrosentinel.core.model.SensorCategory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * sensorIds: [water_meter_001]
 * zscoreThreshold: 2.5
 * qualityThreshold: 0.8
 * windowSize: 600
 * bufferCapacity: 1000
 * minSamplesForConfidence: 30
 * workerCount: 4
 * backpressurePolicy: DROP
 * bounds:
 *   flow: { min: 0, max: 10000 }
 * thresholds:
 *   latencyTargetMs: 120
 *   errorRateWarning: 0.02
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Components copy the values they
 * need at construction time, so an instance must not be mutated once a
 * pipeline has been built from it.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig {

    /** Known sensor ids. Empty means any well-formed id is accepted. */
    private List<String> sensorIds = new ArrayList<>();

    // --- Detection ---
    private double zscoreThreshold = 2.5;
    private double qualityThreshold = 0.8;
    private int windowSize = 600;
    private int minSamplesForConfidence = 30;

    // --- Validation ---
    private long latenessToleranceMs = 2_000;
    private long maxClockSkewMs = 300_000;
    private double interpolationPenalty = 0.6;
    private long stalenessHorizonMs = 60_000;
    private Map<String, CategoryBounds> bounds = new LinkedHashMap<>();

    // --- Buffer / workers ---
    private int bufferCapacity = 1000;
    private int workerCount = 4;
    private String backpressurePolicy = BackpressurePolicy.DROP.name();
    private long enqueueTimeoutMs = 50;
    private long drainTimeoutMs = 10_000;

    // --- Streams ---
    private long streamIdleTimeoutMs = 3_600_000;

    // --- Downstream delivery ---
    private int deliveryAttempts = 3;
    private long deliveryBackoffMs = 50;

    // --- Monitoring ---
    private long reportIntervalMs = 60_000;
    private AlertThresholds thresholds = new AlertThresholds();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every value, collecting all problems before failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (zscoreThreshold <= 0) {
            errors.add("zscoreThreshold must be > 0, got: " + zscoreThreshold);
        }
        if (qualityThreshold < 0 || qualityThreshold > 1) {
            errors.add("qualityThreshold must be in [0, 1], got: " + qualityThreshold);
        }
        if (windowSize < 2) {
            errors.add("windowSize must be >= 2, got: " + windowSize);
        }
        if (minSamplesForConfidence < 2) {
            errors.add("minSamplesForConfidence must be >= 2, got: " + minSamplesForConfidence);
        }
        if (latenessToleranceMs < 0) {
            errors.add("latenessToleranceMs must be >= 0, got: " + latenessToleranceMs);
        }
        if (maxClockSkewMs < 0) {
            errors.add("maxClockSkewMs must be >= 0, got: " + maxClockSkewMs);
        }
        if (interpolationPenalty < 0 || interpolationPenalty > 1) {
            errors.add("interpolationPenalty must be in [0, 1], got: " + interpolationPenalty);
        }
        if (stalenessHorizonMs <= 0) {
            errors.add("stalenessHorizonMs must be > 0, got: " + stalenessHorizonMs);
        }
        if (bufferCapacity < 1) {
            errors.add("bufferCapacity must be >= 1, got: " + bufferCapacity);
        }
        if (workerCount < 1) {
            errors.add("workerCount must be >= 1, got: " + workerCount);
        }
        try {
            backpressure();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (enqueueTimeoutMs < 0) {
            errors.add("enqueueTimeoutMs must be >= 0, got: " + enqueueTimeoutMs);
        }
        if (drainTimeoutMs < 0) {
            errors.add("drainTimeoutMs must be >= 0, got: " + drainTimeoutMs);
        }
        if (streamIdleTimeoutMs <= 0) {
            errors.add("streamIdleTimeoutMs must be > 0, got: " + streamIdleTimeoutMs);
        }
        if (deliveryAttempts < 1) {
            errors.add("deliveryAttempts must be >= 1, got: " + deliveryAttempts);
        }
        if (deliveryBackoffMs < 0) {
            errors.add("deliveryBackoffMs must be >= 0, got: " + deliveryBackoffMs);
        }
        if (reportIntervalMs <= 0) {
            errors.add("reportIntervalMs must be > 0, got: " + reportIntervalMs);
        }

        bounds.forEach((name, b) -> {
            if (SensorCategory.fromName(name).isEmpty()) {
                errors.add("Unknown category in bounds: '" + name + "'. Supported: flow, quality, weather");
            } else if (b == null || b.getMin() > b.getMax()) {
                errors.add("Bounds for '" + name + "' must satisfy min <= max, got: " + b);
            }
        });

        if (thresholds == null) {
            errors.add("thresholds must not be null");
        } else {
            thresholds.validateInto(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    /**
     * @param category sensor category
     * @return configured bounds, or the built-in default for the category
     */
    public CategoryBounds boundsFor(SensorCategory category) {
        CategoryBounds configured = bounds.get(category.getTopicSegment());
        return configured != null ? configured : CategoryBounds.defaultFor(category);
    }

    /**
     * @return the backpressure policy
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public BackpressurePolicy backpressure() {
        try {
            return BackpressurePolicy.valueOf(backpressurePolicy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown backpressurePolicy: '" + backpressurePolicy
                    + "'. Supported: DROP, BOUNDED_WAIT");
        }
    }

    public Duration latenessTolerance() {
        return Duration.ofMillis(latenessToleranceMs);
    }

    public Duration maxClockSkew() {
        return Duration.ofMillis(maxClockSkewMs);
    }

    public Duration stalenessHorizon() {
        return Duration.ofMillis(stalenessHorizonMs);
    }

    public Duration enqueueTimeout() {
        return Duration.ofMillis(enqueueTimeoutMs);
    }

    public Duration drainTimeout() {
        return Duration.ofMillis(drainTimeoutMs);
    }

    public Duration streamIdleTimeout() {
        return Duration.ofMillis(streamIdleTimeoutMs);
    }

    public Duration deliveryBackoff() {
        return Duration.ofMillis(deliveryBackoffMs);
    }

    public Duration reportInterval() {
        return Duration.ofMillis(reportIntervalMs);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable list of known sensor ids
     */
    public List<String> getSensorIds() {
        return Collections.unmodifiableList(sensorIds);
    }

    public void setSensorIds(List<String> sensorIds) {
        this.sensorIds = sensorIds != null ? new ArrayList<>(sensorIds) : new ArrayList<>();
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public void setQualityThreshold(double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinSamplesForConfidence() {
        return minSamplesForConfidence;
    }

    public void setMinSamplesForConfidence(int minSamplesForConfidence) {
        this.minSamplesForConfidence = minSamplesForConfidence;
    }

    public long getLatenessToleranceMs() {
        return latenessToleranceMs;
    }

    public void setLatenessToleranceMs(long latenessToleranceMs) {
        this.latenessToleranceMs = latenessToleranceMs;
    }

    /**
     * @return how far ahead of the local clock a reading's timestamp may be
     *         before it is refused
     */
    public long getMaxClockSkewMs() {
        return maxClockSkewMs;
    }

    public void setMaxClockSkewMs(long maxClockSkewMs) {
        this.maxClockSkewMs = maxClockSkewMs;
    }

    public double getInterpolationPenalty() {
        return interpolationPenalty;
    }

    public void setInterpolationPenalty(double interpolationPenalty) {
        this.interpolationPenalty = interpolationPenalty;
    }

    public long getStalenessHorizonMs() {
        return stalenessHorizonMs;
    }

    public void setStalenessHorizonMs(long stalenessHorizonMs) {
        this.stalenessHorizonMs = stalenessHorizonMs;
    }

    public Map<String, CategoryBounds> getBounds() {
        return Collections.unmodifiableMap(bounds);
    }

    /**
     * Set per-category bounds; keys are normalised to lowercase.
     *
     * @param bounds category name to bounds
     */
    public void setBounds(Map<String, CategoryBounds> bounds) {
        this.bounds = new LinkedHashMap<>();
        if (bounds != null) {
            bounds.forEach((k, v) -> this.bounds.put(k.toLowerCase(Locale.ROOT), v));
        }
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
        this.bufferCapacity = bufferCapacity;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public String getBackpressurePolicy() {
        return backpressurePolicy;
    }

    public void setBackpressurePolicy(String backpressurePolicy) {
        this.backpressurePolicy = backpressurePolicy;
    }

    public long getEnqueueTimeoutMs() {
        return enqueueTimeoutMs;
    }

    public void setEnqueueTimeoutMs(long enqueueTimeoutMs) {
        this.enqueueTimeoutMs = enqueueTimeoutMs;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public long getStreamIdleTimeoutMs() {
        return streamIdleTimeoutMs;
    }

    public void setStreamIdleTimeoutMs(long streamIdleTimeoutMs) {
        this.streamIdleTimeoutMs = streamIdleTimeoutMs;
    }

    public int getDeliveryAttempts() {
        return deliveryAttempts;
    }

    public void setDeliveryAttempts(int deliveryAttempts) {
        this.deliveryAttempts = deliveryAttempts;
    }

    public long getDeliveryBackoffMs() {
        return deliveryBackoffMs;
    }

    public void setDeliveryBackoffMs(long deliveryBackoffMs) {
        this.deliveryBackoffMs = deliveryBackoffMs;
    }

    public long getReportIntervalMs() {
        return reportIntervalMs;
    }

    public void setReportIntervalMs(long reportIntervalMs) {
        this.reportIntervalMs = reportIntervalMs;
    }

    public AlertThresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(AlertThresholds thresholds) {
        this.thresholds = thresholds != null ? thresholds : new AlertThresholds();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "sensorIds=" + sensorIds +
                ", zscoreThreshold=" + zscoreThreshold +
                ", qualityThreshold=" + qualityThreshold +
                ", windowSize=" + windowSize +
                ", minSamplesForConfidence=" + minSamplesForConfidence +
                ", maxClockSkewMs=" + maxClockSkewMs +
                ", bufferCapacity=" + bufferCapacity +
                ", workerCount=" + workerCount +
                ", backpressurePolicy=" + backpressurePolicy +
                ", bounds=" + bounds +
                ", thresholds=" + thresholds +
                '}';
    }
}
