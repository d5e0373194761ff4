package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.config.AlertThresholds;
import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.Classification;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.SensorCategory;
import com.hydrosentinel.core.monitor.PerformanceMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DownstreamDispatcher}.
 */
class DownstreamDispatcherTest {

    private PerformanceMonitor monitor;
    private CleanedReading reading;
    private AnomalyVerdict verdict;

    @BeforeEach
    void setUp() {
        monitor = new PerformanceMonitor(new AlertThresholds());
        reading = CleanedReading.builder()
                .sensorId("f-1")
                .category(SensorCategory.FLOW)
                .timestamp(Instant.now())
                .value(3.0)
                .confidence(1.0)
                .build();
        verdict = AnomalyVerdict.builder()
                .reading(reading)
                .classification(Classification.NORMAL)
                .evaluatedAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("Should retry a failing consumer until it succeeds")
    void shouldRetryUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        ReadingConsumer flaky = (r, v) -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
        };
        DownstreamDispatcher dispatcher = new DownstreamDispatcher(List.of(flaky), 3, Duration.ofMillis(1), monitor);

        assertThat(dispatcher.deliver(reading, verdict)).isZero();
        assertThat(calls.get()).isEqualTo(3);
        assertThat(monitor.snapshot().getDeliveryFailureCount()).isZero();
    }

    @Test
    @DisplayName("Exhausted consumer should be counted while the others still receive the reading")
    void shouldIsolateFailingConsumer() {
        AtomicInteger brokenCalls = new AtomicInteger();
        AtomicInteger healthyCalls = new AtomicInteger();
        ReadingConsumer broken = (r, v) -> {
            brokenCalls.incrementAndGet();
            throw new IllegalStateException("down");
        };
        ReadingConsumer healthy = (r, v) -> healthyCalls.incrementAndGet();
        DownstreamDispatcher dispatcher = new DownstreamDispatcher(List.of(broken, healthy), 3,
                Duration.ofMillis(1), monitor);

        assertThat(dispatcher.deliver(reading, verdict)).isEqualTo(1);
        assertThat(brokenCalls.get()).isEqualTo(3);
        assertThat(healthyCalls.get()).isEqualTo(1);
        assertThat(monitor.snapshot().getDeliveryFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> new DownstreamDispatcher(List.of(), 0, Duration.ZERO, monitor))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
