package com.hydrosentinel.core.monitor;

import com.hydrosentinel.core.config.AlertThresholds;
import com.hydrosentinel.core.model.Alert;
import com.hydrosentinel.core.model.MetricsSnapshot;
import com.hydrosentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Observes processing latency, buffer occupancy and reading outcomes over a
 * trailing window, and evaluates alert thresholds.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Workers write concurrently; any thread may call {@link #snapshot()} or
 * {@link #checkThresholds()}. Every series is a lock-free deque, so readers
 * copy and never block writers.
 * </p>
 *
 * <h3>Alerts</h3>
 * <p>
 * Alerting is advisory: the monitor never throttles the pipeline. An alert
 * on a given metric is suppressed while the previous alert on the same
 * metric is younger than the configured cooldown.
 * </p>
 *
 * <h3>Exposed metrics</h3>
 * <ul>
 * <li>{@code processing.latency.mean} – mean receipt-to-completion time</li>
 * <li>{@code processing.latency.p95} – 95th percentile of the same</li>
 * <li>{@code error.rate} – (rejected + errored) / processed</li>
 * <li>{@code buffer.occupancy} – latest reported occupancy</li>
 * <li>{@code transport.connectivity} – transport retry budget exhausted</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PerformanceMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(PerformanceMonitor.class);

    public static final String METRIC_LATENCY_MEAN = "processing.latency.mean";
    public static final String METRIC_LATENCY_P95 = "processing.latency.p95";
    public static final String METRIC_ERROR_RATE = "error.rate";
    public static final String METRIC_BUFFER = "buffer.occupancy";
    public static final String METRIC_CONNECTIVITY = "transport.connectivity";

    private final AlertThresholds thresholds;
    private final long windowNanos;
    private final long cooldownNanos;
    private final Clock clock;
    private final LongSupplier nanoTime;

    private final Map<Stage, TimedSeries<Double>> latencies = new EnumMap<>(Stage.class);
    private final TimedSeries<Double> occupancy;
    private final TimedSeries<Outcome> outcomes;
    private final TimedSeries<Boolean> deliveryFailures;

    private final AtomicReference<String> connectivityLost = new AtomicReference<>();
    private final Map<String, Long> lastAlertNanos = new ConcurrentHashMap<>();

    /**
     * @param thresholds alert thresholds and window settings
     * @param clock      wall-clock source for alert and snapshot timestamps
     * @param nanoTime   monotonic time source
     */
    public PerformanceMonitor(AlertThresholds thresholds, Clock clock, LongSupplier nanoTime) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
        this.windowNanos = Duration.ofMillis(thresholds.getMonitorWindowMs()).toNanos();
        this.cooldownNanos = Duration.ofMillis(thresholds.getAlertCooldownMs()).toNanos();
        int maxSamples = thresholds.getMaxSamples();
        for (Stage stage : Stage.values()) {
            latencies.put(stage, new TimedSeries<>(maxSamples));
        }
        this.occupancy = new TimedSeries<>(maxSamples);
        this.outcomes = new TimedSeries<>(maxSamples);
        this.deliveryFailures = new TimedSeries<>(maxSamples);
    }

    public PerformanceMonitor(AlertThresholds thresholds) {
        this(thresholds, Clock.systemUTC(), System::nanoTime);
    }

    // ---------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------

    /**
     * @param stage    pipeline stage
     * @param duration time spent in the stage
     */
    public void record(Stage stage, Duration duration) {
        Objects.requireNonNull(stage, "stage must not be null");
        long now = nanoTime.getAsLong();
        latencies.get(stage).add(now, duration.toNanos() / 1_000_000.0, now - windowNanos);
    }

    /**
     * @param pct buffer occupancy in percent
     */
    public void recordBufferOccupancy(double pct) {
        long now = nanoTime.getAsLong();
        occupancy.add(now, pct, now - windowNanos);
    }

    /**
     * @param outcome terminal outcome of one reading
     */
    public void recordOutcome(Outcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        long now = nanoTime.getAsLong();
        outcomes.add(now, outcome, now - windowNanos);
    }

    /**
     * Record a downstream delivery that failed after all retries.
     */
    public void recordDeliveryFailure() {
        long now = nanoTime.getAsLong();
        deliveryFailures.add(now, Boolean.TRUE, now - windowNanos);
    }

    /**
     * Record that the transport exhausted its connection retry budget.
     *
     * @param detail description of the last failure
     */
    public void recordConnectivityLost(String detail) {
        connectivityLost.set(detail != null ? detail : "connection lost");
        LOG.warn("Transport connectivity lost: {}", detail);
    }

    /**
     * Clear a previously recorded connectivity loss.
     */
    public void recordConnectivityRestored() {
        if (connectivityLost.getAndSet(null) != null) {
            LOG.info("Transport connectivity restored");
        }
    }

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------

    /**
     * Aggregate the trailing window.
     *
     * @return a new snapshot; pipeline state and stream count are left for
     *         the coordinator to fill in
     */
    public MetricsSnapshot snapshot() {
        long cutoff = nanoTime.getAsLong() - windowNanos;

        double[] total = toArray(latencies.get(Stage.TOTAL).since(cutoff));
        EnumMap<Stage, Double> stageMeans = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            stageMeans.put(stage, mean(toArray(latencies.get(stage).since(cutoff))));
        }

        double[] occ = toArray(occupancy.since(cutoff));

        long processed = 0;
        long errors = 0;
        long anomalies = 0;
        long quarantined = 0;
        long dropped = 0;
        for (Outcome outcome : outcomes.since(cutoff)) {
            if (!outcome.isProcessed()) {
                dropped++;
                continue;
            }
            processed++;
            if (outcome.isError()) {
                errors++;
            } else if (outcome == Outcome.ANOMALY) {
                anomalies++;
            } else if (outcome == Outcome.QUARANTINED) {
                quarantined++;
            }
        }

        return MetricsSnapshot.builder()
                .timestamp(clock.instant())
                .period(Duration.ofNanos(windowNanos))
                .processedCount(processed)
                .meanLatencyMs(mean(total))
                .p95LatencyMs(percentile(total, 95))
                .maxLatencyMs(max(total))
                .stageMeanLatencyMs(stageMeans)
                .currentBufferOccupancyPct(occ.length > 0 ? occ[occ.length - 1] : 0.0)
                .maxBufferOccupancyPct(max(occ))
                .meanBufferOccupancyPct(mean(occ))
                .errorRate(rate(errors, processed))
                .anomalyRate(rate(anomalies, processed))
                .quarantineRate(rate(quarantined, processed))
                .droppedCount(dropped)
                .deliveryFailureCount(deliveryFailures.since(cutoff).size())
                .build();
    }

    /**
     * Evaluate every threshold against the current window.
     *
     * @return alerts that fired and are not in cooldown; possibly empty
     */
    public List<Alert> checkThresholds() {
        MetricsSnapshot s = snapshot();
        List<Alert> alerts = new ArrayList<>();

        if (s.getMeanLatencyMs() > thresholds.getLatencyTargetMs()) {
            alerts.add(alert(METRIC_LATENCY_MEAN, Severity.WARNING, s.getMeanLatencyMs(),
                    thresholds.getLatencyTargetMs(),
                    String.format("High processing time: mean %.2fms", s.getMeanLatencyMs())));
        }

        if (s.getP95LatencyMs() > thresholds.getLatencyAlertMs()) {
            alerts.add(alert(METRIC_LATENCY_P95, Severity.CRITICAL, s.getP95LatencyMs(),
                    thresholds.getLatencyAlertMs(),
                    String.format("Processing time p95 %.2fms above alert level", s.getP95LatencyMs())));
        } else if (s.getP95LatencyMs() > thresholds.getLatencyP95WarningMs()) {
            alerts.add(alert(METRIC_LATENCY_P95, Severity.WARNING, s.getP95LatencyMs(),
                    thresholds.getLatencyP95WarningMs(),
                    String.format("Processing time p95 %.2fms above target", s.getP95LatencyMs())));
        }

        if (s.getProcessedCount() > 0) {
            if (s.getErrorRate() >= thresholds.getErrorRateCritical()) {
                alerts.add(alert(METRIC_ERROR_RATE, Severity.CRITICAL, s.getErrorRate(),
                        thresholds.getErrorRateCritical(),
                        String.format("High error rate: %.2f%%", s.getErrorRate() * 100)));
            } else if (s.getErrorRate() >= thresholds.getErrorRateWarning()) {
                alerts.add(alert(METRIC_ERROR_RATE, Severity.WARNING, s.getErrorRate(),
                        thresholds.getErrorRateWarning(),
                        String.format("Elevated error rate: %.2f%%", s.getErrorRate() * 100)));
            }
        }

        double occ = s.getCurrentBufferOccupancyPct();
        if (occ >= thresholds.getBufferCriticalPct()) {
            alerts.add(alert(METRIC_BUFFER, Severity.CRITICAL, occ, thresholds.getBufferCriticalPct(),
                    String.format("Buffer near capacity: %.1f%%", occ)));
        } else if (occ >= thresholds.getBufferWarningPct()) {
            alerts.add(alert(METRIC_BUFFER, Severity.WARNING, occ, thresholds.getBufferWarningPct(),
                    String.format("Buffer approaching capacity: %.1f%%", occ)));
        }

        String lost = connectivityLost.get();
        if (lost != null) {
            alerts.add(alert(METRIC_CONNECTIVITY, Severity.CRITICAL, 1, 0,
                    "Transport connectivity lost: " + lost));
        }

        return applyCooldown(alerts);
    }

    private List<Alert> applyCooldown(List<Alert> candidates) {
        long now = nanoTime.getAsLong();
        List<Alert> fired = new ArrayList<>(candidates.size());
        for (Alert a : candidates) {
            Long last = lastAlertNanos.get(a.getMetric());
            if (last != null && now - last < cooldownNanos) {
                LOG.trace("Alert on {} suppressed by cooldown", a.getMetric());
                continue;
            }
            lastAlertNanos.put(a.getMetric(), now);
            fired.add(a);
        }
        return fired;
    }

    private Alert alert(String metric, Severity severity, double observed, double threshold, String details) {
        return Alert.builder()
                .metric(metric)
                .severity(severity)
                .observedValue(observed)
                .threshold(threshold)
                .timestamp(clock.instant())
                .details(details)
                .build();
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double max(double[] values) {
        double max = 0.0;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    static double percentile(double[] values, double pct) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = pct / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }

    private static double rate(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }
}
