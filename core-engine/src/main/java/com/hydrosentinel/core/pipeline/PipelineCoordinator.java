package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.buffer.BufferEntry;
import com.hydrosentinel.core.buffer.BufferFullException;
import com.hydrosentinel.core.buffer.IngestionBuffer;
import com.hydrosentinel.core.config.BackpressurePolicy;
import com.hydrosentinel.core.config.PipelineConfig;
import com.hydrosentinel.core.detection.AnomalyDetector;
import com.hydrosentinel.core.detection.ZScoreAnomalyDetector;
import com.hydrosentinel.core.ingest.RawReadingParser;
import com.hydrosentinel.core.model.Alert;
import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.Classification;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.MetricsSnapshot;
import com.hydrosentinel.core.model.RawReading;
import com.hydrosentinel.core.model.Rejection;
import com.hydrosentinel.core.model.Severity;
import com.hydrosentinel.core.monitor.Outcome;
import com.hydrosentinel.core.monitor.PerformanceMonitor;
import com.hydrosentinel.core.monitor.Stage;
import com.hydrosentinel.core.stats.WindowState;
import com.hydrosentinel.core.stats.WindowStatisticsTracker;
import com.hydrosentinel.core.validation.ReadingValidator;
import com.hydrosentinel.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Wires buffer, validator, statistics tracker, detector and monitor into a
 * running pipeline and owns its lifecycle.
 *
 * <h3>Processing</h3>
 * <p>
 * A transport thread calls {@link #submit(RawReading)}; {@code workerCount}
 * workers take readings off the {@link IngestionBuffer}. Readings that fail
 * the stream-independent checks are rejected without creating window state.
 * The rest are validated and classified while holding the stream's
 * {@link WindowState} monitor, against the statistics <em>before</em> the
 * update; only {@code NORMAL} and {@code ANOMALY} readings feed the window
 * and advance its ordering watermark. Delivery to the
 * {@link ReadingConsumer}s happens after the stream lock is released.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@code STOPPED → STARTING → RUNNING → DRAINING → STOPPED}. {@link #stop()}
 * closes the buffer and lets the workers drain it within the drain timeout;
 * whatever is still buffered afterwards is counted as dropped. The
 * coordinator can be started again after it stopped.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #submit}, {@link #metrics()} and {@link #checkThresholds()} may be
 * called from any thread. {@link #start()} and {@link #stop()} are
 * serialized against each other.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final PipelineConfig config;
    private final RawReadingParser parser;
    private final ReadingValidator validator;
    private final WindowStatisticsTracker tracker;
    private final AnomalyDetector detector;
    private final PerformanceMonitor monitor;
    private final DownstreamDispatcher dispatcher;
    private final AlertSink alertSink;
    private final AuditSink auditSink;

    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.STOPPED);
    private final Object lifecycleLock = new Object();

    private volatile IngestionBuffer buffer;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;

    private PipelineCoordinator(Builder builder) {
        this.config = builder.config;
        this.parser = new RawReadingParser(builder.clock);
        this.validator = new ReadingValidator(config, builder.clock);
        this.tracker = new WindowStatisticsTracker(config.getWindowSize(), config.getMinSamplesForConfidence(),
                config.streamIdleTimeout(), builder.clock);
        this.detector = builder.detector != null
                ? builder.detector
                : ZScoreAnomalyDetector.fromConfig(config, builder.clock);
        this.monitor = builder.monitor != null
                ? builder.monitor
                : new PerformanceMonitor(config.getThresholds(), builder.clock, System::nanoTime);
        this.dispatcher = new DownstreamDispatcher(builder.consumers, config.getDeliveryAttempts(),
                config.deliveryBackoff(), monitor);
        this.alertSink = builder.alertSink;
        this.auditSink = builder.auditSink != null ? builder.auditSink : new LoggingAuditSink();
    }

    public static Builder builder(PipelineConfig config) {
        return new Builder(config);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Create a fresh buffer, spawn the workers and schedule the periodic
     * report and idle-stream sweep.
     *
     * @throws IllegalStateException if the pipeline is not {@code STOPPED}
     */
    public void start() {
        synchronized (lifecycleLock) {
            transition(PipelineState.STOPPED, PipelineState.STARTING);

            IngestionBuffer fresh = new IngestionBuffer(config.getBufferCapacity());
            buffer = fresh;

            workers = Executors.newFixedThreadPool(config.getWorkerCount(), daemonThreads("pipeline-worker"));
            for (int i = 0; i < config.getWorkerCount(); i++) {
                workers.execute(() -> workerLoop(fresh));
            }

            scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("pipeline-monitor"));
            long reportMs = config.getReportIntervalMs();
            scheduler.scheduleAtFixedRate(this::report, reportMs, reportMs, TimeUnit.MILLISECONDS);
            long sweepMs = Math.max(1_000L, config.getStreamIdleTimeoutMs() / 4);
            scheduler.scheduleAtFixedRate(this::sweepIdleStreams, sweepMs, sweepMs, TimeUnit.MILLISECONDS);

            transition(PipelineState.STARTING, PipelineState.RUNNING);
            LOG.info("Pipeline started: workers={}, bufferCapacity={}, backpressure={}, consumers={}, detector={}",
                    config.getWorkerCount(), config.getBufferCapacity(), config.backpressure(),
                    dispatcher.consumerCount(), detector.getName());
        }
    }

    /**
     * Stop accepting readings, drain the buffer within the drain timeout and
     * stop the workers. Calling {@code stop()} on a stopped pipeline is a
     * no-op.
     *
     * @throws IllegalStateException if the pipeline is starting or already
     *                               draining
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (state.get() == PipelineState.STOPPED) {
                return;
            }
            transition(PipelineState.RUNNING, PipelineState.DRAINING);
            IngestionBuffer draining = buffer;
            int pending = draining.size();
            LOG.info("Pipeline draining: {} buffered reading(s), timeout={}ms", pending, config.getDrainTimeoutMs());

            draining.close();
            workers.shutdown();
            if (!awaitWorkers(config.drainTimeout())) {
                List<BufferEntry> leftover = draining.drainRemaining();
                for (int i = 0; i < leftover.size(); i++) {
                    monitor.recordOutcome(Outcome.DROPPED);
                }
                LOG.warn("Drain timeout exceeded – dropped {} buffered reading(s), interrupting workers",
                        leftover.size());
                workers.shutdownNow();
                awaitWorkers(Duration.ofSeconds(1));
            }
            scheduler.shutdownNow();

            transition(PipelineState.DRAINING, PipelineState.STOPPED);
            LOG.info("Pipeline stopped. Final statistics: {}", metrics());
        }
    }

    private boolean awaitWorkers(Duration timeout) {
        try {
            return workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void transition(PipelineState expected, PipelineState next) {
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException(
                    "Illegal pipeline transition to " + next + " from " + state.get() + " (expected " + expected + ")");
        }
        LOG.debug("Pipeline state {} -> {}", expected, next);
    }

    // -------------------------------------------------------------------------
    // Ingestion
    // -------------------------------------------------------------------------

    /**
     * Hand one reading to the buffer, applying the backpressure policy.
     *
     * @param raw reading from the transport
     * @return {@code true} if the reading was buffered; {@code false} if it
     *         was dropped
     */
    public boolean submit(RawReading raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        IngestionBuffer current = buffer;
        if (state.get() != PipelineState.RUNNING || current == null) {
            LOG.debug("Pipeline not running ({}) – dropping reading from [{}]", state.get(), raw.getTopic());
            monitor.recordOutcome(Outcome.DROPPED);
            return false;
        }
        try {
            if (config.backpressure() == BackpressurePolicy.BOUNDED_WAIT) {
                current.offer(raw, config.enqueueTimeout());
            } else {
                current.enqueue(raw);
            }
            monitor.recordBufferOccupancy(current.occupancyPercent());
            return true;
        } catch (BufferFullException e) {
            LOG.debug("Buffer full ({} readings) – dropping reading from [{}]", e.getCapacity(), raw.getTopic());
            monitor.recordBufferOccupancy(current.occupancyPercent());
            monitor.recordOutcome(Outcome.DROPPED);
            return false;
        } catch (IllegalStateException e) {
            LOG.debug("Buffer closed – dropping reading from [{}]", raw.getTopic());
            monitor.recordOutcome(Outcome.DROPPED);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            monitor.recordOutcome(Outcome.DROPPED);
            return false;
        }
    }

    /**
     * Parse a transport payload and submit it.
     *
     * @param topic   topic the payload arrived on
     * @param payload raw message bytes
     * @return {@code true} if the reading was buffered
     */
    public boolean submit(String topic, byte[] payload) {
        return submit(parser.parse(topic, payload));
    }

    // -------------------------------------------------------------------------
    // Worker
    // -------------------------------------------------------------------------

    private void workerLoop(IngestionBuffer source) {
        while (true) {
            BufferEntry entry;
            try {
                entry = source.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (entry == null) {
                return;
            }
            monitor.recordBufferOccupancy(source.occupancyPercent());
            process(entry.getReading());
        }
    }

    void process(RawReading raw) {
        Outcome outcome;
        try {
            outcome = evaluate(raw);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure processing reading from [{}] sensor [{}]",
                    raw.getTopic(), raw.getSensorId(), e);
            outcome = Outcome.ERROR;
        }
        monitor.recordOutcome(outcome);
        monitor.record(Stage.TOTAL, Duration.ofNanos(System.nanoTime() - raw.getReceivedNanos()));
    }

    private Outcome evaluate(RawReading raw) {
        // stream-independent checks run before any window state exists for the reading
        Optional<Rejection> early = timed(Stage.VALIDATION, () -> validator.precheck(raw));
        if (early.isPresent()) {
            return reject(early.get());
        }

        Evaluation evaluation = evaluateUnderStreamLock(raw);
        if (evaluation.rejection != null) {
            return reject(evaluation.rejection);
        }

        AnomalyVerdict verdict = evaluation.verdict;
        CleanedReading cleaned = verdict.getReading();
        if (verdict.getClassification() == Classification.QUARANTINED) {
            auditSink.quarantined(cleaned, verdict);
            return Outcome.QUARANTINED;
        }
        if (verdict.isAnomaly()) {
            if (verdict.getSeverity() == Severity.CRITICAL) {
                LOG.warn("CRITICAL anomaly: sensor={} value={} z={}", cleaned.getSensorId(), cleaned.getValue(),
                        String.format("%.2f", verdict.getZScore()));
            } else {
                LOG.info("Anomaly: sensor={} value={} z={}", cleaned.getSensorId(), cleaned.getValue(),
                        String.format("%.2f", verdict.getZScore()));
            }
        }
        long started = System.nanoTime();
        dispatcher.deliver(cleaned, verdict);
        monitor.record(Stage.DELIVERY, Duration.ofNanos(System.nanoTime() - started));
        return verdict.isAnomaly() ? Outcome.ANOMALY : Outcome.NORMAL;
    }

    private Evaluation evaluateUnderStreamLock(RawReading raw) {
        String streamId = raw.streamId();
        while (true) {
            WindowState window = tracker.acquire(streamId);
            synchronized (window) {
                if (window.isRetired()) {
                    continue;
                }
                ValidationResult result = timed(Stage.VALIDATION, () -> validator.validate(raw, window));
                if (!result.isAccepted()) {
                    return Evaluation.rejected(result.getRejection().orElseThrow());
                }
                CleanedReading cleaned = result.getCleaned().orElseThrow();
                AnomalyVerdict verdict = timed(Stage.CLASSIFICATION,
                        () -> detector.classify(cleaned, window.stats()));
                if (verdict.getClassification().feedsWindow()) {
                    window.markAccepted(cleaned.getTimestamp());
                    long started = System.nanoTime();
                    tracker.record(window, cleaned.getTimestamp(), cleaned.getValue());
                    monitor.record(Stage.WINDOW_UPDATE, Duration.ofNanos(System.nanoTime() - started));
                }
                return Evaluation.accepted(verdict);
            }
        }
    }

    private Outcome reject(Rejection rejection) {
        LOG.debug("Rejected reading: {}", rejection);
        auditSink.rejected(rejection);
        return Outcome.REJECTED;
    }

    private <T> T timed(Stage stage, Supplier<T> step) {
        long started = System.nanoTime();
        try {
            return step.get();
        } finally {
            monitor.record(stage, Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private static final class Evaluation {
        private final AnomalyVerdict verdict;
        private final Rejection rejection;

        private Evaluation(AnomalyVerdict verdict, Rejection rejection) {
            this.verdict = verdict;
            this.rejection = rejection;
        }

        static Evaluation accepted(AnomalyVerdict verdict) {
            return new Evaluation(verdict, null);
        }

        static Evaluation rejected(Rejection rejection) {
            return new Evaluation(null, rejection);
        }
    }

    // -------------------------------------------------------------------------
    // Monitoring
    // -------------------------------------------------------------------------

    /**
     * @return current performance snapshot, including pipeline state and the
     *         number of tracked streams
     */
    public MetricsSnapshot metrics() {
        refreshOccupancy();
        return monitor.snapshot().withPipeline(state.get().name(), tracker.streamCount());
    }

    /**
     * Evaluate the alert thresholds now.
     *
     * @return alerts raised; empty when every metric is within bounds or
     *         cooling down
     */
    public List<Alert> checkThresholds() {
        refreshOccupancy();
        return monitor.checkThresholds();
    }

    private void refreshOccupancy() {
        IngestionBuffer current = buffer;
        if (current != null && state.get() == PipelineState.RUNNING) {
            monitor.recordBufferOccupancy(current.occupancyPercent());
        }
    }

    void report() {
        try {
            LOG.info("Performance summary: {}", metrics());
            for (Alert alert : checkThresholds()) {
                publish(alert);
            }
        } catch (RuntimeException e) {
            LOG.error("Periodic performance report failed", e);
        }
    }

    private void publish(Alert alert) {
        if (alert.getSeverity() == Severity.CRITICAL) {
            LOG.error("ALERT {}", alert);
        } else {
            LOG.warn("ALERT {}", alert);
        }
        if (alertSink == null) {
            return;
        }
        try {
            alertSink.publish(alert);
        } catch (Exception e) {
            LOG.error("Failed to publish alert [{}]", alert.getMetric(), e);
            monitor.recordDeliveryFailure();
        }
    }

    private void sweepIdleStreams() {
        try {
            int evicted = tracker.evictIdle();
            if (evicted > 0) {
                LOG.info("Evicted {} idle stream(s); {} still tracked", evicted, tracker.streamCount());
            }
        } catch (RuntimeException e) {
            LOG.error("Idle-stream sweep failed", e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public PipelineState getState() {
        return state.get();
    }

    /**
     * @return the monitor, for transports reporting connectivity
     */
    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    public WindowStatisticsTracker getTracker() {
        return tracker;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static class Builder {
        private final PipelineConfig config;
        private final List<ReadingConsumer> consumers = new ArrayList<>();
        private AlertSink alertSink;
        private AuditSink auditSink;
        private AnomalyDetector detector;
        private PerformanceMonitor monitor;
        private Clock clock = Clock.systemUTC();

        private Builder(PipelineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        public Builder consumer(ReadingConsumer consumer) {
            consumers.add(Objects.requireNonNull(consumer, "consumer must not be null"));
            return this;
        }

        public Builder consumers(List<? extends ReadingConsumer> consumers) {
            consumers.forEach(this::consumer);
            return this;
        }

        public Builder alertSink(AlertSink alertSink) {
            this.alertSink = alertSink;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        /** Defaults to a {@link ZScoreAnomalyDetector} built from the config. */
        public Builder detector(AnomalyDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder monitor(PerformanceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * @return a stopped coordinator
         * @throws IllegalStateException if the configuration is invalid
         */
        public PipelineCoordinator build() {
            config.validate();
            return new PipelineCoordinator(this);
        }
    }
}
