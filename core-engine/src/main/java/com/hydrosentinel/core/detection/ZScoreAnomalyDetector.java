package com.hydrosentinel.core.detection;

import com.hydrosentinel.core.config.PipelineConfig;
import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.Classification;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.Severity;
import com.hydrosentinel.core.stats.WindowStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Z-score detector gated by reading quality.
 *
 * <h3>Rule</h3>
 * <ol>
 * <li>{@code qualityScore < qualityThreshold} → {@link Classification#QUARANTINED},
 * whatever the z-score</li>
 * <li>window below the minimum sample count → {@link Classification#NORMAL},
 * flagged low confidence</li>
 * <li>{@code |z| > zThreshold} → {@link Classification#ANOMALY}, severity
 * {@link Severity#CRITICAL} above {@code 2 × zThreshold}, otherwise
 * {@link Severity#WARNING}</li>
 * <li>otherwise {@link Classification#NORMAL}</li>
 * </ol>
 *
 * <h3>Constant streams</h3>
 * <p>
 * When the window's standard deviation is zero the z-score is defined as
 * {@code 0}, so a constant stream never produces anomalies from a division
 * by zero.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    private final double zThreshold;
    private final double qualityThreshold;
    private final QualityScorer qualityScorer;
    private final Clock clock;

    /**
     * @param zThreshold       z-score above which a reading is anomalous; must be &gt; 0
     * @param qualityThreshold quality below which a reading is quarantined
     * @param qualityScorer    quality scoring strategy
     * @param clock            time source for verdict timestamps
     * @throws IllegalArgumentException if a threshold is out of range
     */
    public ZScoreAnomalyDetector(double zThreshold, double qualityThreshold,
            QualityScorer qualityScorer, Clock clock) {
        if (zThreshold <= 0) {
            throw new IllegalArgumentException("zThreshold must be > 0, got: " + zThreshold);
        }
        if (qualityThreshold < 0 || qualityThreshold > 1) {
            throw new IllegalArgumentException("qualityThreshold must be in [0, 1], got: " + qualityThreshold);
        }
        this.zThreshold = zThreshold;
        this.qualityThreshold = qualityThreshold;
        this.qualityScorer = Objects.requireNonNull(qualityScorer, "qualityScorer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Build a detector from the pipeline configuration.
     *
     * @param config pipeline configuration
     * @param clock  time source
     * @return a configured detector
     */
    public static ZScoreAnomalyDetector fromConfig(PipelineConfig config, Clock clock) {
        return new ZScoreAnomalyDetector(
                config.getZscoreThreshold(),
                config.getQualityThreshold(),
                new QualityScorer(config.stalenessHorizon(), clock),
                clock);
    }

    @Override
    public AnomalyVerdict classify(CleanedReading reading, WindowStats stats) {
        Objects.requireNonNull(reading, "reading must not be null");
        Objects.requireNonNull(stats, "stats must not be null");

        double z = zScore(reading.getValue(), stats);
        double quality = qualityScorer.score(reading);

        AnomalyVerdict.Builder verdict = AnomalyVerdict.builder()
                .reading(reading)
                .zScore(z)
                .qualityScore(quality)
                .lowConfidence(stats.isLowConfidence())
                .evaluatedAt(clock.instant());

        if (quality < qualityThreshold) {
            LOG.trace("Quarantine [{}]: quality={} < {}", reading.getSensorId(), quality, qualityThreshold);
            return verdict.classification(Classification.QUARANTINED).severity(Severity.NONE).build();
        }
        if (stats.isLowConfidence()) {
            return verdict.classification(Classification.NORMAL).severity(Severity.NONE).build();
        }

        double magnitude = Math.abs(z);
        if (magnitude > zThreshold) {
            Severity severity = magnitude > 2 * zThreshold ? Severity.CRITICAL : Severity.WARNING;
            LOG.debug("Anomaly [{}]: value={} mean={} stddev={} z={} severity={}",
                    reading.getSensorId(), reading.getValue(), stats.getMean(), stats.getStddev(), z, severity);
            return verdict.classification(Classification.ANOMALY).severity(severity).build();
        }
        return verdict.classification(Classification.NORMAL).severity(Severity.NONE).build();
    }

    /**
     * @param value observed value
     * @param stats window stats
     * @return {@code (value - mean) / stddev}, or {@code 0} for an empty or
     *         constant window
     */
    static double zScore(double value, WindowStats stats) {
        if (stats.isEmpty() || stats.getStddev() == 0.0) {
            return 0.0;
        }
        return (value - stats.getMean()) / stats.getStddev();
    }

    @Override
    public String getName() {
        return "zscore";
    }
}
