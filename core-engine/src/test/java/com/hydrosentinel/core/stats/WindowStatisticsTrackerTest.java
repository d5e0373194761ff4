package com.hydrosentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WindowStatisticsTracker}.
 */
class WindowStatisticsTrackerTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    @DisplayName("Constant window has mean 10 and stddev 0; an outlier moves it to mean 28, stddev 36")
    void shouldSlideWindowOfFive() {
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(5, 2);
        WindowStats stats = null;
        for (int i = 0; i < 5; i++) {
            stats = tracker.update("flow:s1", T0.plusSeconds(i), 10);
        }
        assertThat(stats.getMean()).isEqualTo(10.0);
        assertThat(stats.getStddev()).isEqualTo(0.0);
        assertThat(stats.getCount()).isEqualTo(5);

        stats = tracker.update("flow:s1", T0.plusSeconds(5), 100);

        assertThat(stats.getCount()).isEqualTo(5);
        assertThat(stats.getMean()).isCloseTo(28.0, within(1e-9));
        assertThat(stats.getStddev()).isCloseTo(36.0, within(1e-9));
    }

    @Test
    @DisplayName("Should match exact population statistics over the last window of values")
    void shouldMatchExactStatistics() {
        int window = 50;
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(window, 2);
        Random random = new Random(42);
        double[] values = new double[1_000];
        for (int i = 0; i < values.length; i++) {
            values[i] = 500 + random.nextGaussian() * 40;
            tracker.update("quality:ph-1", T0.plusSeconds(i), values[i]);

            if (i % 97 == 0 || i == values.length - 1) {
                int from = Math.max(0, i + 1 - window);
                double[] expected = exact(values, from, i + 1);
                WindowStats stats = tracker.stats("quality:ph-1");
                assertThat(stats.getCount()).isEqualTo(i + 1 - from);
                assertThat(stats.getMean()).isCloseTo(expected[0], within(1e-6));
                assertThat(stats.getStddev()).isCloseTo(expected[1], within(1e-6));
            }
        }
    }

    @Test
    @DisplayName("Should flag windows below the confidence sample count")
    void shouldFlagLowConfidence() {
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(10, 3);

        assertThat(tracker.update("flow:s1", T0, 1).isLowConfidence()).isTrue();
        assertThat(tracker.update("flow:s1", T0.plusSeconds(1), 2).isLowConfidence()).isTrue();
        assertThat(tracker.update("flow:s1", T0.plusSeconds(2), 3).isLowConfidence()).isFalse();
    }

    @Test
    @DisplayName("Streams should be tracked independently")
    void shouldIsolateStreams() {
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(10, 2);
        tracker.update("flow:a", T0, 1);
        tracker.update("flow:a", T0.plusSeconds(1), 3);
        tracker.update("weather:a", T0, 100);

        assertThat(tracker.stats("flow:a").getMean()).isEqualTo(2.0);
        assertThat(tracker.stats("weather:a").getMean()).isEqualTo(100.0);
        assertThat(tracker.stats("flow:unknown").isEmpty()).isTrue();
        assertThat(tracker.streamCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject NaN and infinite values")
    void shouldRejectNonFinite() {
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(10, 2);

        assertThatThrownBy(() -> tracker.update("flow:s1", T0, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.update("flow:s1", T0, Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.stats("flow:s1").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should evict streams idle for longer than the timeout")
    void shouldEvictIdleStreams() {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(10, 2, Duration.ofMinutes(10), clock);
        tracker.update("flow:old", 1);
        WindowState old = tracker.acquire("flow:old");

        assertThat(tracker.evictIdle(T0.plus(Duration.ofMinutes(5)))).isZero();
        assertThat(tracker.evictIdle(T0.plus(Duration.ofMinutes(11)))).isEqualTo(1);
        assertThat(tracker.streamCount()).isZero();
        assertThat(old.isRetired()).isTrue();

        // a fresh state replaces the retired one
        tracker.update("flow:old", 7);
        assertThat(tracker.stats("flow:old").getCount()).isEqualTo(1);
        assertThat(tracker.acquire("flow:old")).isNotSameAs(old);
    }

    @Test
    @DisplayName("Recent samples should be exposed newest first")
    void shouldExposeRecentSamples() {
        WindowStatisticsTracker tracker = new WindowStatisticsTracker(3, 2);
        tracker.update("flow:s1", T0, 1);
        tracker.update("flow:s1", T0.plusSeconds(1), 2);
        tracker.update("flow:s1", T0.plusSeconds(2), 3);
        tracker.update("flow:s1", T0.plusSeconds(3), 4);

        WindowState state = tracker.acquire("flow:s1");
        assertThat(state.sampleCount()).isEqualTo(3);
        assertThat(state.recentSample(0)).hasValueSatisfying(s -> assertThat(s.getValue()).isEqualTo(4.0));
        assertThat(state.recentSample(2)).hasValueSatisfying(s -> assertThat(s.getValue()).isEqualTo(2.0));
        assertThat(state.recentSample(3)).isEmpty();
    }

    private static double[] exact(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        double mean = sum / (to - from);
        double squares = 0;
        for (int i = from; i < to; i++) {
            squares += (values[i] - mean) * (values[i] - mean);
        }
        return new double[] { mean, Math.sqrt(squares / (to - from)) };
    }
}
