package com.hydrosentinel.service;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.pipeline.ReadingConsumer;

import java.util.Objects;

/**
 * Publishes anomalous readings as JSON on {@code <anomalyTopic>/<sensorId>}.
 * Normal readings are ignored.
 */
public class MqttAnomalyPublisher implements ReadingConsumer {

    private final MessagePublisher publisher;
    private final String topic;
    private final int qos;
    private final JsonCodec codec;

    public MqttAnomalyPublisher(MessagePublisher publisher, String topic, int qos, JsonCodec codec) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.qos = qos;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public void accept(CleanedReading reading, AnomalyVerdict verdict) throws Exception {
        if (!verdict.isAnomaly()) {
            return;
        }
        publisher.publish(topic + "/" + reading.getSensorId(), codec.anomaly(reading, verdict), qos);
    }

    @Override
    public String getName() {
        return "mqtt-anomalies";
    }
}
