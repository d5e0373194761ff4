package com.hydrosentinel.service;

import org.eclipse.paho.client.mqttv3.MqttException;

/**
 * Outbound side of the transport.
 */
@FunctionalInterface
public interface MessagePublisher {

    /**
     * @param topic   destination topic
     * @param payload message body
     * @param qos     MQTT quality of service
     * @throws MqttException if the message could not be handed to the broker
     */
    void publish(String topic, byte[] payload, int qos) throws MqttException;
}
