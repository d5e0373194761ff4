package com.hydrosentinel.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of the Hydro Sentinel ingest service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. Pipeline tuning (thresholds, window sizes, workers) lives in
 * the YAML file named by {@code PIPELINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    /** Topic filters the sensors publish on. */
    public static final List<String> DEFAULT_TOPICS = List.of(
            "sensors/water/flow/#",
            "sensors/water/quality/#",
            "sensors/weather/#",
            "sensor/+/data");

    // ---------------------------------------------------------------
    // MQTT
    // ---------------------------------------------------------------
    private final String brokerUrl;
    private final String clientId;
    private final List<String> topics;
    private final int qos;
    private final String alertTopic;
    private final String anomalyTopic;
    private final int connectAttempts;
    private final long backoffMs;
    private final long maxBackoffMs;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String pipelineConfigPath;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.brokerUrl = b.brokerUrl;
        this.clientId = b.clientId;
        this.topics = Collections.unmodifiableList(new ArrayList<>(b.topics));
        this.qos = b.qos;
        this.alertTopic = b.alertTopic;
        this.anomalyTopic = b.anomalyTopic;
        this.connectAttempts = b.connectAttempts;
        this.backoffMs = b.backoffMs;
        this.maxBackoffMs = b.maxBackoffMs;
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .brokerUrl(env("MQTT_BROKER_URL", "tcp://localhost:1883"))
                    .clientId(env("MQTT_CLIENT_ID", "hydro-sentinel"))
                    .topics(parseList(env("MQTT_TOPICS", String.join(",", DEFAULT_TOPICS))))
                    .qos(parseIntEnv("MQTT_QOS", "1"))
                    .alertTopic(env("MQTT_ALERT_TOPIC", "hydro-sentinel/alerts"))
                    .anomalyTopic(env("MQTT_ANOMALY_TOPIC", "hydro-sentinel/anomalies"))
                    .connectAttempts(parseIntEnv("MQTT_CONNECT_ATTEMPTS", "5"))
                    .backoffMs(parseLongEnv("MQTT_BACKOFF_MS", "1000"))
                    .maxBackoffMs(parseLongEnv("MQTT_MAX_BACKOFF_MS", "30000"))
                    .pipelineConfigPath(env("PIPELINE_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Split a comma-separated list, trimming entries and dropping blanks.
     *
     * @param csv comma-separated values
     * @return the entries in order
     */
    static List<String> parseList(String csv) {
        List<String> out = new ArrayList<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getBrokerUrl() {
        return brokerUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public List<String> getTopics() {
        return topics;
    }

    public int getQos() {
        return qos;
    }

    public String getAlertTopic() {
        return alertTopic;
    }

    public String getAnomalyTopic() {
        return anomalyTopic;
    }

    public int getConnectAttempts() {
        return connectAttempts;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (QoS in [0, 2], at least one topic filter, attempts &gt;= 1,
     * backoff &gt;= 0, port in [0, 65535] where 0 picks a free port).
     * </p>
     */
    public static class Builder {
        private String brokerUrl = "tcp://localhost:1883";
        private String clientId = "hydro-sentinel";
        private List<String> topics = DEFAULT_TOPICS;
        private int qos = 1;
        private String alertTopic = "hydro-sentinel/alerts";
        private String anomalyTopic = "hydro-sentinel/anomalies";
        private int connectAttempts = 5;
        private long backoffMs = 1_000;
        private long maxBackoffMs = 30_000;
        private String pipelineConfigPath = "";
        private int healthPort = 8080;

        public Builder brokerUrl(String v) {
            this.brokerUrl = v;
            return this;
        }

        public Builder clientId(String v) {
            this.clientId = v;
            return this;
        }

        public Builder topics(List<String> v) {
            this.topics = v;
            return this;
        }

        public Builder qos(int v) {
            this.qos = v;
            return this;
        }

        public Builder alertTopic(String v) {
            this.alertTopic = v;
            return this;
        }

        public Builder anomalyTopic(String v) {
            this.anomalyTopic = v;
            return this;
        }

        public Builder connectAttempts(int v) {
            this.connectAttempts = v;
            return this;
        }

        public Builder backoffMs(long v) {
            this.backoffMs = v;
            return this;
        }

        public Builder maxBackoffMs(long v) {
            this.maxBackoffMs = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requireNonBlank(brokerUrl, "brokerUrl");
            requireNonBlank(clientId, "clientId");
            requireNonBlank(alertTopic, "alertTopic");
            requireNonBlank(anomalyTopic, "anomalyTopic");
            Objects.requireNonNull(topics, "topics required");
            Objects.requireNonNull(pipelineConfigPath, "pipelineConfigPath required");

            if (topics.isEmpty()) {
                throw new IllegalArgumentException("At least one topic filter is required");
            }
            topics.forEach(t -> requireNonBlank(t, "topic filter"));
            if (qos < 0 || qos > 2) {
                throw new IllegalArgumentException("qos must be in [0, 2], got: " + qos);
            }
            if (connectAttempts < 1) {
                throw new IllegalArgumentException("connectAttempts must be >= 1, got: " + connectAttempts);
            }
            if (backoffMs < 0) {
                throw new IllegalArgumentException("backoffMs must be >= 0, got: " + backoffMs);
            }
            if (maxBackoffMs < backoffMs) {
                throw new IllegalArgumentException(
                        "maxBackoffMs must be >= backoffMs, got: " + maxBackoffMs + " < " + backoffMs);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "brokerUrl='" + brokerUrl + '\'' +
                ", clientId='" + clientId + '\'' +
                ", topics=" + topics +
                ", qos=" + qos +
                ", alertTopic='" + alertTopic + '\'' +
                ", anomalyTopic='" + anomalyTopic + '\'' +
                ", connectAttempts=" + connectAttempts +
                ", backoffMs=" + backoffMs +
                ", maxBackoffMs=" + maxBackoffMs +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
