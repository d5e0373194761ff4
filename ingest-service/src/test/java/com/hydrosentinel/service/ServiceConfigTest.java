package com.hydrosentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceConfigTest {

    @Test
    @DisplayName("Builder defaults subscribe to every sensor topic family")
    void defaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getBrokerUrl()).isEqualTo("tcp://localhost:1883");
        assertThat(config.getTopics()).containsExactly(
                "sensors/water/flow/#", "sensors/water/quality/#", "sensors/weather/#", "sensor/+/data");
        assertThat(config.getQos()).isEqualTo(1);
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Comma-separated topic lists are trimmed and blanks dropped")
    void parseList() {
        assertThat(ServiceConfig.parseList(" a/#, ,b/+/c ,")).containsExactly("a/#", "b/+/c");
    }

    @Test
    @DisplayName("QoS outside [0, 2] is rejected")
    void invalidQos() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().qos(3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qos");
    }

    @Test
    @DisplayName("An empty topic list is rejected")
    void emptyTopics() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().topics(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("topic");
    }

    @Test
    @DisplayName("Max backoff below the initial backoff is rejected")
    void backoffOrdering() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().backoffMs(500).maxBackoffMs(100).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBackoffMs");
    }

    @Test
    @DisplayName("Health port 0 is allowed, negative ports are not")
    void healthPort() {
        assertThat(new ServiceConfig.Builder().healthPort(0).build().getHealthPort()).isZero();
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Blank broker URL is rejected")
    void blankBroker() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().brokerUrl(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("brokerUrl");
    }
}
