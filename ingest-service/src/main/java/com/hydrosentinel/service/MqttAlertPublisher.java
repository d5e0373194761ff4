package com.hydrosentinel.service;

import com.hydrosentinel.core.model.Alert;
import com.hydrosentinel.core.pipeline.AlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes performance alerts as JSON on the alert topic.
 */
public class MqttAlertPublisher implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(MqttAlertPublisher.class);

    private final MessagePublisher publisher;
    private final String topic;
    private final int qos;
    private final JsonCodec codec;

    public MqttAlertPublisher(MessagePublisher publisher, String topic, int qos, JsonCodec codec) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.qos = qos;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public void publish(Alert alert) throws Exception {
        publisher.publish(topic, codec.alert(alert), qos);
        LOG.debug("Published {} alert on {} to [{}]", alert.getSeverity(), alert.getMetric(), topic);
    }
}
