package com.hydrosentinel.service;

import com.hydrosentinel.core.config.PipelineConfig;
import com.hydrosentinel.core.config.PipelineConfigLoader;
import com.hydrosentinel.core.monitor.PerformanceMonitor;
import com.hydrosentinel.core.pipeline.LoggingAuditSink;
import com.hydrosentinel.core.pipeline.PipelineCoordinator;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Hydro Sentinel ingest service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   MQTT (sensor topics)
 *     → parse JSON → RawReading
 *     → ingestion buffer → worker pool
 *     → validate → classify (z-score, quality) → window update
 *     → consumers (log, MQTT anomaly topic)
 *   PerformanceMonitor → periodic report → MQTT alert topic
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Transport and HTTP settings come from environment variables via
 * {@link ServiceConfig}; pipeline tuning from YAML via
 * {@link PipelineConfigLoader}.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * A JVM shutdown hook disconnects the transport first, then drains the
 * pipeline, then stops the health server.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelService.class);

    private SentinelService() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws MqttException, InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Hydro Sentinel with config: {}", config);
        PipelineConfig pipelineConfig = loadPipeline(config);

        // 2. Wire transport, publishers and pipeline
        JsonCodec codec = new JsonCodec();
        PerformanceMonitor monitor = new PerformanceMonitor(pipelineConfig.getThresholds());
        MqttClient client = new MqttClient(config.getBrokerUrl(), config.getClientId(), new MemoryPersistence());
        MqttTransport transport = new MqttTransport(config, client, monitor);

        PipelineCoordinator coordinator = PipelineCoordinator.builder(pipelineConfig)
                .monitor(monitor)
                .consumer(new LoggingReadingConsumer())
                .consumer(new MqttAnomalyPublisher(transport, config.getAnomalyTopic(), config.getQos(), codec))
                .alertSink(new MqttAlertPublisher(transport, config.getAlertTopic(), config.getQos(), codec))
                .auditSink(new LoggingAuditSink())
                .build();

        // 3. Start health server (for K8s liveness and readiness checks)
        HealthServer healthServer = new HealthServer(coordinator::getState, coordinator::metrics, codec);
        healthServer.start(config.getHealthPort());

        // 4. Shutdown hook: stop intake, drain, then release main
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            transport.close();
            coordinator.stop();
            healthServer.stop();
            stopped.countDown();
        }, "sentinel-shutdown"));

        // 5. Start processing before messages arrive, then connect
        coordinator.start();
        if (!transport.start(coordinator::submit)) {
            LOG.error("MQTT broker {} unreachable; retrying in the background", config.getBrokerUrl());
        }

        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static PipelineConfig loadPipeline(ServiceConfig config) {
        String path = config.getPipelineConfigPath();
        if (path != null && !path.isBlank()) {
            return PipelineConfigLoader.fromFile(path);
        }
        return PipelineConfigLoader.load();
    }
}
