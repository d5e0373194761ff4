package com.hydrosentinel.core.ingest;

import com.hydrosentinel.core.model.RawReading;
import com.hydrosentinel.core.model.SensorCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RawReadingParser}.
 */
class RawReadingParserTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private RawReadingParser parser;

    @BeforeEach
    void setUp() {
        parser = new RawReadingParser(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should parse a well-formed flow payload")
    void shouldParseFlowPayload() {
        RawReading reading = parse("sensors/water/flow/f-1",
                "{\"sensor_id\":\"f-1\",\"timestamp\":\"2024-06-01T00:00:00Z\",\"value\":12.5,"
                        + "\"quality_score\":0.9,\"metadata\":{\"unit\":\"l/s\"},\"site\":\"north\"}");

        assertThat(reading.isMalformed()).isFalse();
        assertThat(reading.getSensorId()).isEqualTo("f-1");
        assertThat(reading.getCategory()).isEqualTo(SensorCategory.FLOW);
        assertThat(reading.getRawTimestamp()).isEqualTo("2024-06-01T00:00:00Z");
        assertThat(((Number) reading.getRawValue()).doubleValue()).isEqualTo(12.5);
        assertThat(reading.getReportedQuality()).contains(0.9);
        assertThat(reading.getMetadata())
                .containsEntry("unit", "l/s")
                .containsEntry("site", "north");
        assertThat(reading.getReceivedAt()).isEqualTo(NOW);
        assertThat(reading.streamId()).isEqualTo("flow:f-1");
    }

    @Test
    @DisplayName("Category should come from the payload before the topic")
    void payloadCategoryShouldWin() {
        RawReading reading = parse("sensor/ph-1/data",
                "{\"sensorId\":\"ph-1\",\"category\":\"quality\",\"timestamp\":1717200000,\"value\":7.1}");

        assertThat(reading.getCategory()).isEqualTo(SensorCategory.QUALITY);
        assertThat(reading.getSensorId()).isEqualTo("ph-1");
    }

    @Test
    @DisplayName("Category should fall back to the topic, then to FLOW")
    void categoryShouldFallBack() {
        assertThat(parse("sensors/weather/rain-1", "{\"sensor_id\":\"rain-1\",\"value\":1}").getCategory())
                .isEqualTo(SensorCategory.WEATHER);
        assertThat(parse("sensor/x/data", "{\"sensor_id\":\"x\",\"value\":1}").getCategory())
                .isEqualTo(SensorCategory.FLOW);
    }

    @Test
    @DisplayName("Missing and null values should stay absent for the validator to handle")
    void missingValueShouldBeNull() {
        RawReading reading = parse("sensors/water/flow/f-1",
                "{\"sensor_id\":\"f-1\",\"timestamp\":\"2024-06-01T00:00:00Z\",\"value\":null}");

        assertThat(reading.isMalformed()).isFalse();
        assertThat(reading.getRawValue()).isNull();
        assertThat(reading.getReportedQuality()).isEmpty();
    }

    @Test
    @DisplayName("Textual values should be kept as text")
    void textValueShouldBeKept() {
        RawReading reading = parse("sensors/water/flow/f-1", "{\"sensor_id\":\"f-1\",\"value\":\"abc\"}");

        assertThat(reading.getRawValue()).isEqualTo("abc");
    }

    @Test
    @DisplayName("Invalid JSON should yield a malformed reading instead of throwing")
    void invalidJsonShouldBeMalformed() {
        RawReading reading = parse("sensors/water/flow/f-1", "{not json");

        assertThat(reading.isMalformed()).isTrue();
        assertThat(reading.getMalformedReason()).hasValueSatisfying(r -> assertThat(r).contains("invalid JSON"));
        assertThat(reading.getTopic()).isEqualTo("sensors/water/flow/f-1");
    }

    @Test
    @DisplayName("Empty payloads and non-object JSON should be malformed")
    void emptyOrNonObjectShouldBeMalformed() {
        assertThat(parser.parse("t", new byte[0]).isMalformed()).isTrue();
        assertThat(parser.parse("t", null).isMalformed()).isTrue();
        assertThat(parse("t", "[1,2,3]").isMalformed()).isTrue();
        assertThat(parse("t", "42").isMalformed()).isTrue();
    }

    @Test
    @DisplayName("Non-numeric quality score should be malformed")
    void nonNumericQualityShouldBeMalformed() {
        RawReading reading = parse("sensors/water/flow/f-1",
                "{\"sensor_id\":\"f-1\",\"value\":1,\"quality_score\":\"good\"}");

        assertThat(reading.isMalformed()).isTrue();
    }

    private RawReading parse(String topic, String json) {
        return parser.parse(topic, json.getBytes(StandardCharsets.UTF_8));
    }
}
