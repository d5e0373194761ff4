package com.hydrosentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hydrosentinel.core.model.Alert;
import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.MetricsSnapshot;

/**
 * Converts outbound messages to JSON bytes: alerts for the alert topic,
 * anomaly events for the anomaly topic and metrics snapshots for
 * {@code GET /metrics}.
 *
 * <p>
 * Dates are written as ISO-8601 strings. Thread-safe.
 * </p>
 */
public class JsonCodec {

    private final ObjectMapper mapper;

    public JsonCodec() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param alert alert to encode
     * @return JSON bytes
     * @throws IllegalStateException if serialization fails
     */
    public byte[] alert(Alert alert) {
        return write(alert);
    }

    /**
     * Encode an anomaly event in the same snake_case shape sensors publish.
     *
     * @param reading the anomalous reading
     * @param verdict its verdict
     * @return JSON bytes
     * @throws IllegalStateException if serialization fails
     */
    public byte[] anomaly(CleanedReading reading, AnomalyVerdict verdict) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "anomaly");
        node.put("sensor_id", reading.getSensorId());
        node.put("category", reading.getCategory().getTopicSegment());
        node.put("timestamp", reading.getTimestamp().toString());
        node.put("value", reading.getValue());
        node.put("z_score", verdict.getZScore());
        node.put("severity", verdict.getSeverity().name());
        node.put("quality_score", verdict.getQualityScore());
        node.put("interpolated", reading.isInterpolated());
        node.put("low_confidence", verdict.isLowConfidence());
        return write(node);
    }

    /**
     * @param snapshot metrics snapshot
     * @return JSON bytes
     * @throws IllegalStateException if serialization fails
     */
    public byte[] metrics(MetricsSnapshot snapshot) {
        return write(snapshot);
    }

    private byte[] write(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
