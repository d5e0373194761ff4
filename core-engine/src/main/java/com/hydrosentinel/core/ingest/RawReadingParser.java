package com.hydrosentinel.core.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hydrosentinel.core.model.RawReading;
import com.hydrosentinel.core.model.SensorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a transport payload ({@code topic}, JSON bytes) into a
 * {@link RawReading}.
 *
 * <p>
 * Recognised fields: {@code sensor_id} (or {@code sensorId}),
 * {@code timestamp}, {@code value}, {@code quality_score} (or
 * {@code qualityScore}), {@code category} and {@code metadata}. Any other
 * top-level field is kept in the reading's metadata.
 * </p>
 *
 * <p>
 * Parsing never throws: a payload that is empty, not JSON, not a JSON object
 * or carries a non-numeric quality score yields a
 * {@linkplain RawReading#malformed(String, String) malformed} reading so that
 * it is rejected and counted inside the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public class RawReadingParser {

    private static final Logger LOG = LoggerFactory.getLogger(RawReadingParser.class);

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "sensor_id", "sensorId", "timestamp", "value", "quality_score", "qualityScore",
            "category", "metadata");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Clock clock;

    public RawReadingParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public RawReadingParser() {
        this(Clock.systemUTC());
    }

    /**
     * @param topic   topic the payload arrived on
     * @param payload raw payload bytes
     * @return the parsed reading, possibly marked malformed; never {@code null}
     */
    public RawReading parse(String topic, byte[] payload) {
        long receivedNanos = System.nanoTime();
        if (payload == null || payload.length == 0) {
            return RawReading.malformed(topic, "empty payload");
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            LOG.warn("Failed to parse payload on topic [{}] – marking malformed: {}", topic, e.getMessage());
            return RawReading.malformed(topic, "invalid JSON: " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            return RawReading.malformed(topic, "payload is not a JSON object");
        }

        JsonNode quality = first(root, "quality_score", "qualityScore");
        Double reportedQuality = null;
        if (quality != null && !quality.isNull()) {
            if (quality.isNumber()) {
                reportedQuality = quality.doubleValue();
            } else if (quality.isTextual() && isNumeric(quality.asText())) {
                reportedQuality = Double.parseDouble(quality.asText().trim());
            } else {
                return RawReading.malformed(topic, "quality_score is not numeric: " + quality);
            }
        }

        JsonNode id = first(root, "sensor_id", "sensorId");
        JsonNode categoryNode = root.get("category");
        SensorCategory category = SensorCategory.fromName(categoryNode != null ? categoryNode.asText() : null)
                .or(() -> SensorCategory.fromTopic(topic))
                .orElse(SensorCategory.FLOW);

        return RawReading.builder()
                .topic(topic)
                .sensorId(id != null && id.isValueNode() && !id.isNull() ? id.asText() : null)
                .category(category)
                .rawTimestamp(scalar(root.get("timestamp")))
                .rawValue(scalar(root.get("value")))
                .reportedQuality(reportedQuality)
                .metadata(metadata(root))
                .receivedAt(clock.instant())
                .receivedNanos(receivedNanos)
                .build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static JsonNode first(JsonNode root, String primary, String alternate) {
        JsonNode node = root.get(primary);
        return node != null ? node : root.get(alternate);
    }

    /**
     * Numbers stay numbers, text stays text, null and absent become
     * {@code null}; structures are kept as their JSON text so they fail
     * numeric checks downstream.
     */
    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }

    private Map<String, Object> metadata(JsonNode root) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode explicit = root.get("metadata");
        if (explicit != null && explicit.isObject()) {
            try {
                metadata.putAll(mapper.convertValue(explicit, MAP_TYPE));
            } catch (IllegalArgumentException e) {
                LOG.debug("Ignoring unreadable metadata block: {}", e.getMessage());
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                metadata.put(field.getKey(), scalar(field.getValue()));
            }
        }
        return metadata;
    }

    private static boolean isNumeric(String text) {
        try {
            return Double.isFinite(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
