package com.hydrosentinel.core.detection;

import com.hydrosentinel.core.config.PipelineConfig;
import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.Classification;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.SensorCategory;
import com.hydrosentinel.core.model.Severity;
import com.hydrosentinel.core.stats.WindowStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreAnomalyDetector}.
 */
class ZScoreAnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private ZScoreAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = ZScoreAnomalyDetector.fromConfig(new PipelineConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Value close to the mean should be NORMAL")
    void shouldClassifyNormal() {
        AnomalyVerdict verdict = detector.classify(reading(105, 1.0), stats(100, 10));

        assertThat(verdict.getClassification()).isEqualTo(Classification.NORMAL);
        assertThat(verdict.getSeverity()).isEqualTo(Severity.NONE);
        assertThat(verdict.getZScore()).isCloseTo(0.5, within(1e-9));
        assertThat(verdict.getQualityScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Value beyond the z threshold should be a WARNING anomaly")
    void shouldClassifyWarningAnomaly() {
        AnomalyVerdict verdict = detector.classify(reading(130, 1.0), stats(100, 10));

        assertThat(verdict.getClassification()).isEqualTo(Classification.ANOMALY);
        assertThat(verdict.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(verdict.isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Value beyond twice the z threshold should be a CRITICAL anomaly")
    void shouldClassifyCriticalAnomaly() {
        AnomalyVerdict verdict = detector.classify(reading(40, 1.0), stats(100, 10));

        assertThat(verdict.getClassification()).isEqualTo(Classification.ANOMALY);
        assertThat(verdict.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(verdict.getZScore()).isCloseTo(-6.0, within(1e-9));
    }

    @Test
    @DisplayName("A constant window (stddev 0) should never produce an anomaly")
    void constantWindowShouldNeverFlag() {
        WindowStats constant = stats(10, 0);
        for (double value : new double[] { 10, 11, 1_000, 0 }) {
            AnomalyVerdict verdict = detector.classify(reading(value, 1.0), constant);
            assertThat(verdict.getClassification()).isNotEqualTo(Classification.ANOMALY);
            assertThat(verdict.getZScore()).isZero();
        }
    }

    @Test
    @DisplayName("Quality 0.5 should always be QUARANTINED, even for an extreme value")
    void lowQualityShouldBeQuarantined() {
        assertThat(detector.classify(reading(100, 0.5), stats(100, 10)).getClassification())
                .isEqualTo(Classification.QUARANTINED);
        assertThat(detector.classify(reading(10_000, 0.5), stats(100, 10)).getClassification())
                .isEqualTo(Classification.QUARANTINED);
    }

    @Test
    @DisplayName("Stale readings should lose quality and end up quarantined")
    void staleReadingShouldBeQuarantined() {
        CleanedReading stale = CleanedReading.builder()
                .sensorId("flow-1")
                .category(SensorCategory.FLOW)
                .timestamp(NOW.minusSeconds(100))
                .value(100)
                .confidence(1.0)
                .build();

        AnomalyVerdict verdict = detector.classify(stale, stats(100, 10));

        assertThat(verdict.getQualityScore()).isCloseTo(1.0 / 3, within(1e-3));
        assertThat(verdict.getClassification()).isEqualTo(Classification.QUARANTINED);
    }

    @Test
    @DisplayName("Low-confidence window should classify NORMAL and carry the advisory flag")
    void lowConfidenceWindowShouldBeNormal() {
        WindowStats young = new WindowStats(100, 10, 5, true);

        AnomalyVerdict verdict = detector.classify(reading(1_000, 1.0), young);

        assertThat(verdict.getClassification()).isEqualTo(Classification.NORMAL);
        assertThat(verdict.isLowConfidence()).isTrue();
    }

    @Test
    @DisplayName("Empty window should classify NORMAL")
    void emptyWindowShouldBeNormal() {
        AnomalyVerdict verdict = detector.classify(reading(50, 1.0), WindowStats.empty());

        assertThat(verdict.getClassification()).isEqualTo(Classification.NORMAL);
    }

    @Test
    @DisplayName("Should reject a non-positive z threshold")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new ZScoreAnomalyDetector(0, 0.8,
                new QualityScorer(Duration.ofMinutes(1), Clock.systemUTC()), Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static WindowStats stats(double mean, double stddev) {
        return new WindowStats(mean, stddev, 100, false);
    }

    private static CleanedReading reading(double value, double confidence) {
        return CleanedReading.builder()
                .sensorId("flow-1")
                .category(SensorCategory.FLOW)
                .timestamp(NOW)
                .value(value)
                .confidence(confidence)
                .build();
    }
}
