package com.hydrosentinel.core.monitor;

import com.hydrosentinel.core.config.AlertThresholds;
import com.hydrosentinel.core.model.Alert;
import com.hydrosentinel.core.model.MetricsSnapshot;
import com.hydrosentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PerformanceMonitor}.
 */
class PerformanceMonitorTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000_000L);
    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        monitor = new PerformanceMonitor(new AlertThresholds(), clock, nanos::get);
    }

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Snapshot should aggregate latency, outcomes and occupancy")
    void shouldAggregateSnapshot() {
        for (int i = 1; i <= 100; i++) {
            monitor.record(Stage.TOTAL, Duration.ofMillis(i));
        }
        monitor.record(Stage.VALIDATION, Duration.ofMillis(2));
        monitor.record(Stage.VALIDATION, Duration.ofMillis(4));
        monitor.recordBufferOccupancy(10);
        monitor.recordBufferOccupancy(30);
        monitor.recordOutcome(Outcome.NORMAL);
        monitor.recordOutcome(Outcome.ANOMALY);
        monitor.recordOutcome(Outcome.QUARANTINED);
        monitor.recordOutcome(Outcome.REJECTED);
        monitor.recordOutcome(Outcome.DROPPED);
        monitor.recordDeliveryFailure();

        MetricsSnapshot s = monitor.snapshot();

        assertThat(s.getMeanLatencyMs()).isCloseTo(50.5, within(1e-9));
        assertThat(s.getP95LatencyMs()).isCloseTo(95.05, within(1e-9));
        assertThat(s.getMaxLatencyMs()).isEqualTo(100.0);
        assertThat(s.getStageMeanLatencyMs()).containsEntry("VALIDATION", 3.0);
        assertThat(s.getCurrentBufferOccupancyPct()).isEqualTo(30.0);
        assertThat(s.getMaxBufferOccupancyPct()).isEqualTo(30.0);
        assertThat(s.getMeanBufferOccupancyPct()).isEqualTo(20.0);
        assertThat(s.getProcessedCount()).isEqualTo(4);
        assertThat(s.getErrorRate()).isEqualTo(0.25);
        assertThat(s.getAnomalyRate()).isEqualTo(0.25);
        assertThat(s.getQuarantineRate()).isEqualTo(0.25);
        assertThat(s.getDroppedCount()).isEqualTo(1);
        assertThat(s.getDeliveryFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Empty monitor should report zeros")
    void emptySnapshotShouldBeZero() {
        MetricsSnapshot s = monitor.snapshot();

        assertThat(s.getProcessedCount()).isZero();
        assertThat(s.getMeanLatencyMs()).isZero();
        assertThat(s.getP95LatencyMs()).isZero();
        assertThat(s.getErrorRate()).isZero();
        assertThat(monitor.checkThresholds()).isEmpty();
    }

    @Test
    @DisplayName("Samples older than the monitoring window should be excluded")
    void shouldForgetSamplesOutsideWindow() {
        monitor.recordOutcome(Outcome.ERROR);
        monitor.record(Stage.TOTAL, Duration.ofMillis(500));

        nanos.addAndGet(Duration.ofMinutes(6).toNanos());
        monitor.recordOutcome(Outcome.NORMAL);

        MetricsSnapshot s = monitor.snapshot();
        assertThat(s.getProcessedCount()).isEqualTo(1);
        assertThat(s.getErrorRate()).isZero();
        assertThat(s.getMeanLatencyMs()).isZero();
    }

    @Test
    @DisplayName("Percentile should interpolate between closest ranks")
    void percentileShouldInterpolate() {
        assertThat(PerformanceMonitor.percentile(new double[] { 10, 20 }, 95)).isCloseTo(19.5, within(1e-9));
        assertThat(PerformanceMonitor.percentile(new double[] { 7 }, 95)).isEqualTo(7.0);
        assertThat(PerformanceMonitor.percentile(new double[0], 95)).isZero();
    }

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Slow processing should raise a mean WARNING and a p95 CRITICAL")
    void shouldAlertOnLatency() {
        for (int i = 0; i < 10; i++) {
            monitor.record(Stage.TOTAL, Duration.ofMillis(300));
        }

        List<Alert> alerts = monitor.checkThresholds();

        assertThat(alerts).extracting(Alert::getMetric)
                .containsExactlyInAnyOrder(PerformanceMonitor.METRIC_LATENCY_MEAN, PerformanceMonitor.METRIC_LATENCY_P95);
        assertThat(find(alerts, PerformanceMonitor.METRIC_LATENCY_MEAN).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(find(alerts, PerformanceMonitor.METRIC_LATENCY_P95).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("p95 between 200ms and 250ms should only warn")
    void shouldWarnOnModerateP95() {
        for (int i = 0; i < 10; i++) {
            monitor.record(Stage.TOTAL, Duration.ofMillis(i < 8 ? 50 : 220));
        }

        List<Alert> alerts = monitor.checkThresholds();

        assertThat(find(alerts, PerformanceMonitor.METRIC_LATENCY_P95).getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Error rate of 5% should be CRITICAL; 2% should be WARNING; 1% silent")
    void shouldAlertOnErrorRate() {
        outcomes(95, 5);
        assertThat(find(monitor.checkThresholds(), PerformanceMonitor.METRIC_ERROR_RATE).getSeverity())
                .isEqualTo(Severity.CRITICAL);

        PerformanceMonitor warning = fresh();
        outcomes(warning, 98, 2);
        assertThat(find(warning.checkThresholds(), PerformanceMonitor.METRIC_ERROR_RATE).getSeverity())
                .isEqualTo(Severity.WARNING);

        PerformanceMonitor quiet = fresh();
        outcomes(quiet, 99, 1);
        assertThat(quiet.checkThresholds()).isEmpty();
    }

    @Test
    @DisplayName("Dropped readings should not count toward the error rate")
    void droppedShouldNotAffectErrorRate() {
        outcomes(100, 0);
        for (int i = 0; i < 50; i++) {
            monitor.recordOutcome(Outcome.DROPPED);
        }

        assertThat(monitor.snapshot().getErrorRate()).isZero();
        assertThat(monitor.snapshot().getDroppedCount()).isEqualTo(50);
    }

    @Test
    @DisplayName("Buffer occupancy should warn at 80% and be critical at 95%")
    void shouldAlertOnBufferOccupancy() {
        monitor.recordBufferOccupancy(85);
        assertThat(find(monitor.checkThresholds(), PerformanceMonitor.METRIC_BUFFER).getSeverity())
                .isEqualTo(Severity.WARNING);

        PerformanceMonitor critical = fresh();
        critical.recordBufferOccupancy(96);
        Alert alert = find(critical.checkThresholds(), PerformanceMonitor.METRIC_BUFFER);
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getObservedValue()).isEqualTo(96.0);
        assertThat(alert.getThreshold()).isEqualTo(95.0);
    }

    @Test
    @DisplayName("Lost connectivity should be CRITICAL until restored")
    void shouldAlertOnConnectivity() {
        monitor.recordConnectivityLost("broker unreachable");

        Alert alert = find(monitor.checkThresholds(), PerformanceMonitor.METRIC_CONNECTIVITY);
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getDetails()).contains("broker unreachable");

        monitor.recordConnectivityRestored();
        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        assertThat(monitor.checkThresholds()).isEmpty();
    }

    @Test
    @DisplayName("Repeated alerts on the same metric should be suppressed during the cooldown")
    void shouldApplyCooldown() {
        monitor.recordBufferOccupancy(99);

        assertThat(monitor.checkThresholds()).hasSize(1);
        assertThat(monitor.checkThresholds()).isEmpty();

        nanos.addAndGet(Duration.ofSeconds(4).toNanos());
        assertThat(monitor.checkThresholds()).isEmpty();

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        monitor.recordBufferOccupancy(99);
        assertThat(monitor.checkThresholds()).hasSize(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private PerformanceMonitor fresh() {
        return new PerformanceMonitor(new AlertThresholds(),
                Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC), nanos::get);
    }

    private void outcomes(int normal, int errors) {
        outcomes(monitor, normal, errors);
    }

    private static void outcomes(PerformanceMonitor target, int normal, int errors) {
        for (int i = 0; i < normal; i++) {
            target.recordOutcome(Outcome.NORMAL);
        }
        for (int i = 0; i < errors; i++) {
            target.recordOutcome(Outcome.REJECTED);
        }
    }

    private static Alert find(List<Alert> alerts, String metric) {
        return alerts.stream()
                .filter(a -> a.getMetric().equals(metric))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No alert for " + metric + " in " + alerts));
    }
}
