package com.hydrosentinel.core.buffer;

import com.hydrosentinel.core.model.RawReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IngestionBuffer}.
 */
class IngestionBufferTest {

    @Test
    @DisplayName("Should reject the 1001st reading with BufferFullException at exactly 100% occupancy")
    void shouldRejectWhenFull() {
        IngestionBuffer buffer = new IngestionBuffer(1000);
        for (int i = 0; i < 1000; i++) {
            buffer.enqueue(reading("s" + i));
        }

        assertThatThrownBy(() -> buffer.enqueue(reading("overflow")))
                .isInstanceOf(BufferFullException.class)
                .hasMessageContaining("1000");
        assertThat(buffer.size()).isEqualTo(1000);
        assertThat(buffer.occupancyPercent()).isEqualTo(100.0);
        assertThat(buffer.occupancyLevel()).isEqualTo(OccupancyLevel.CRITICAL);
    }

    @Test
    @DisplayName("Should dequeue in FIFO order")
    void shouldDequeueInOrder() throws InterruptedException {
        IngestionBuffer buffer = new IngestionBuffer(10);
        buffer.enqueue(reading("a"));
        buffer.enqueue(reading("b"));
        buffer.enqueue(reading("c"));

        assertThat(buffer.dequeue().getReading().getSensorId()).isEqualTo("a");
        assertThat(buffer.dequeue().getReading().getSensorId()).isEqualTo("b");
        assertThat(buffer.dequeue().getReading().getSensorId()).isEqualTo("c");
        assertThat(buffer.size()).isZero();
    }

    @Test
    @DisplayName("Should report occupancy levels at the 80% and 95% marks")
    void shouldReportOccupancyLevels() {
        IngestionBuffer buffer = new IngestionBuffer(20);
        for (int i = 0; i < 15; i++) {
            buffer.enqueue(reading("s"));
        }
        assertThat(buffer.occupancyLevel()).isEqualTo(OccupancyLevel.NORMAL);

        buffer.enqueue(reading("s"));
        assertThat(buffer.occupancyPercent()).isEqualTo(80.0);
        assertThat(buffer.occupancyLevel()).isEqualTo(OccupancyLevel.WARNING);

        buffer.enqueue(reading("s"));
        buffer.enqueue(reading("s"));
        buffer.enqueue(reading("s"));
        assertThat(buffer.occupancyLevel()).isEqualTo(OccupancyLevel.CRITICAL);
    }

    @Test
    @DisplayName("Bounded offer should give up after the timeout")
    void offerShouldTimeOut() throws InterruptedException {
        IngestionBuffer buffer = new IngestionBuffer(1);
        buffer.enqueue(reading("a"));

        assertThatThrownBy(() -> buffer.offer(reading("b"), Duration.ofMillis(20)))
                .isInstanceOf(BufferFullException.class);
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Bounded offer should succeed once a consumer frees a slot")
    void offerShouldSucceedWhenSpaceFrees() throws Exception {
        IngestionBuffer buffer = new IngestionBuffer(1);
        buffer.enqueue(reading("a"));

        CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
            try {
                buffer.offer(reading("b"), Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        assertThat(buffer.dequeue().getReading().getSensorId()).isEqualTo("a");
        producer.get(5, TimeUnit.SECONDS);
        assertThat(buffer.dequeue().getReading().getSensorId()).isEqualTo("b");
    }

    @Test
    @DisplayName("Closing should wake a blocked consumer and end the stream once empty")
    void closeShouldWakeConsumers() throws Exception {
        IngestionBuffer buffer = new IngestionBuffer(5);
        CompletableFuture<BufferEntry> consumer = CompletableFuture.supplyAsync(() -> {
            try {
                return buffer.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        buffer.close();

        assertThat(consumer.get(5, TimeUnit.SECONDS)).isNull();
        assertThat(buffer.isClosed()).isTrue();
    }

    @Test
    @DisplayName("A closed buffer should still hand out what it holds but refuse new readings")
    void closedBufferShouldDrainButRefuse() throws InterruptedException {
        IngestionBuffer buffer = new IngestionBuffer(5);
        buffer.enqueue(reading("a"));
        buffer.close();

        assertThatThrownBy(() -> buffer.enqueue(reading("b")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(buffer.dequeue().getReading().getSensorId()).isEqualTo("a");
        assertThat(buffer.dequeue()).isNull();
    }

    @Test
    @DisplayName("drainRemaining should empty the buffer")
    void drainRemainingShouldEmpty() {
        IngestionBuffer buffer = new IngestionBuffer(5);
        buffer.enqueue(reading("a"));
        buffer.enqueue(reading("b"));

        assertThat(buffer.drainRemaining()).hasSize(2);
        assertThat(buffer.size()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new IngestionBuffer(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RawReading reading(String sensorId) {
        return RawReading.builder()
                .topic("sensors/water/flow/" + sensorId)
                .sensorId(sensorId)
                .rawTimestamp("2024-01-01T00:00:00Z")
                .rawValue(1.0)
                .build();
    }
}
