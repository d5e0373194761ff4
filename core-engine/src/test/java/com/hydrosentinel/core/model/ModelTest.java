package com.hydrosentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Categories resolve from names and from any matching topic level")
    void categoryResolution() {
        assertThat(SensorCategory.fromName(" Quality ")).contains(SensorCategory.QUALITY);
        assertThat(SensorCategory.fromName("pressure")).isEmpty();
        assertThat(SensorCategory.fromTopic("sensors/water/flow/main-inlet")).contains(SensorCategory.FLOW);
        assertThat(SensorCategory.fromTopic("sensors/weather/roof")).contains(SensorCategory.WEATHER);
        assertThat(SensorCategory.fromTopic("sensor/ph-007/data")).isEmpty();
        assertThat(SensorCategory.fromTopic(null)).isEmpty();
    }

    @Test
    @DisplayName("Cleaned readings refuse non-finite values and out-of-range confidence")
    void cleanedReadingGuards() {
        assertThatThrownBy(() -> reading().value(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reading().confidence(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CleanedReading.builder().sensorId("x").timestamp(T0).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("category");
    }

    @Test
    @DisplayName("Readings of the same sensor in different categories feed different windows")
    void streamIdIncludesCategory() {
        CleanedReading flow = reading().build();
        CleanedReading weather = reading().category(SensorCategory.WEATHER).build();

        assertThat(flow.streamId()).isEqualTo("flow:flow-001");
        assertThat(flow.streamId()).isNotEqualTo(weather.streamId());
    }

    @Test
    @DisplayName("Metadata is copied on build")
    void metadataCopied() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("unit", "L/s");
        CleanedReading built = reading().metadata(metadata).build();

        metadata.put("unit", "m3/h");

        assertThat(built.getMetadata()).containsEntry("unit", "L/s");
        assertThatThrownBy(() -> built.getMetadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Alerts must carry WARNING or CRITICAL severity")
    void alertSeverity() {
        assertThatThrownBy(() -> Alert.builder()
                .metric("error.rate")
                .severity(Severity.NONE)
                .timestamp(T0)
                .build())
                .isInstanceOf(IllegalArgumentException.class);

        Alert alert = Alert.builder().metric("error.rate").severity(Severity.WARNING).timestamp(T0).build();
        assertThat(alert.getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Verdicts without a severity default to NONE")
    void verdictDefaults() {
        AnomalyVerdict verdict = AnomalyVerdict.builder()
                .reading(reading().build())
                .classification(Classification.NORMAL)
                .evaluatedAt(T0)
                .build();

        assertThat(verdict.getSeverity()).isEqualTo(Severity.NONE);
        assertThat(verdict.isAnomaly()).isFalse();
    }

    private static CleanedReading.Builder reading() {
        return CleanedReading.builder()
                .sensorId("flow-001")
                .category(SensorCategory.FLOW)
                .timestamp(T0)
                .value(120.0);
    }
}
