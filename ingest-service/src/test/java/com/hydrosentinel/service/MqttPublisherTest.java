package com.hydrosentinel.service;

import com.hydrosentinel.core.model.Alert;
import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.Classification;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.SensorCategory;
import com.hydrosentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MqttPublisherTest {

    private final List<String> topics = new ArrayList<>();
    private final List<String> payloads = new ArrayList<>();
    private final List<Integer> qosLevels = new ArrayList<>();
    private final MessagePublisher recorder = (topic, payload, qos) -> {
        topics.add(topic);
        payloads.add(new String(payload, StandardCharsets.UTF_8));
        qosLevels.add(qos);
    };
    private final JsonCodec codec = new JsonCodec();

    @Test
    @DisplayName("Anomalies are published under the sensor's own sub-topic")
    void anomalyPublished() throws Exception {
        MqttAnomalyPublisher publisher = new MqttAnomalyPublisher(recorder, "hydro-sentinel/anomalies", 1, codec);
        CleanedReading reading = reading("flow-001");

        publisher.accept(reading, verdict(reading, Classification.ANOMALY, Severity.WARNING));

        assertThat(topics).containsExactly("hydro-sentinel/anomalies/flow-001");
        assertThat(qosLevels).containsExactly(1);
        assertThat(payloads.get(0)).contains("\"sensor_id\":\"flow-001\"").contains("\"severity\":\"WARNING\"");
    }

    @Test
    @DisplayName("Normal and quarantined readings are not published")
    void nonAnomaliesIgnored() throws Exception {
        MqttAnomalyPublisher publisher = new MqttAnomalyPublisher(recorder, "hydro-sentinel/anomalies", 1, codec);
        CleanedReading reading = reading("flow-001");

        publisher.accept(reading, verdict(reading, Classification.NORMAL, Severity.NONE));
        publisher.accept(reading, verdict(reading, Classification.QUARANTINED, Severity.NONE));

        assertThat(topics).isEmpty();
    }

    @Test
    @DisplayName("Alerts go to the configured alert topic")
    void alertPublished() throws Exception {
        MqttAlertPublisher publisher = new MqttAlertPublisher(recorder, "hydro-sentinel/alerts", 2, codec);

        publisher.publish(Alert.builder()
                .metric("buffer.occupancy")
                .severity(Severity.CRITICAL)
                .observedValue(97.0)
                .threshold(95.0)
                .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
                .details("Buffer near capacity: 97.0%")
                .build());

        assertThat(topics).containsExactly("hydro-sentinel/alerts");
        assertThat(qosLevels).containsExactly(2);
        assertThat(payloads.get(0)).contains("\"metric\":\"buffer.occupancy\"");
    }

    private static CleanedReading reading(String sensorId) {
        return CleanedReading.builder()
                .sensorId(sensorId)
                .category(SensorCategory.FLOW)
                .timestamp(Instant.parse("2024-03-01T10:15:30Z"))
                .value(250.0)
                .build();
    }

    private static AnomalyVerdict verdict(CleanedReading reading, Classification classification, Severity severity) {
        return AnomalyVerdict.builder()
                .reading(reading)
                .zScore(classification == Classification.ANOMALY ? 3.4 : 0.2)
                .qualityScore(0.9)
                .classification(classification)
                .severity(severity)
                .evaluatedAt(Instant.parse("2024-03-01T10:15:31Z"))
                .build();
    }
}
