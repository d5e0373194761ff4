package com.hydrosentinel.service;

import com.hydrosentinel.core.monitor.PerformanceMonitor;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MQTT transport adapter built on the Eclipse Paho client.
 *
 * <h3>Inbound</h3>
 * <p>
 * Subscribes to the configured topic filters and hands every message to a
 * {@link ReadingSink}. Message handling never throws back into Paho, since
 * an exception from {@code messageArrived} would close the connection.
 * </p>
 *
 * <h3>Connection management</h3>
 * <p>
 * Connecting and subscribing is retried with bounded exponential backoff
 * ({@code backoffMs}, doubling, capped at {@code maxBackoffMs}). When a round
 * of {@code connectAttempts} fails the loss is reported to the
 * {@link PerformanceMonitor}, which raises a CRITICAL connectivity alert, and
 * a new round is scheduled after {@code maxBackoffMs}. A dropped connection
 * starts the same loop on a background thread.
 * </p>
 *
 * <h3>Outbound</h3>
 * <p>
 * Implements {@link MessagePublisher} for the alert and anomaly publishers.
 * </p>
 *
 * @since 1.0.0
 */
public class MqttTransport implements MqttCallback, MessagePublisher, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MqttTransport.class);

    private final ServiceConfig config;
    private final IMqttClient client;
    private final PerformanceMonitor monitor;
    private final ScheduledExecutorService reconnector;
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ReadingSink sink;

    /**
     * @param config  transport settings
     * @param client  unconnected Paho client
     * @param monitor receives connectivity loss and restoration
     */
    public MqttTransport(ServiceConfig config, IMqttClient client, PerformanceMonitor monitor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.reconnector = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mqtt-reconnect");
            t.setDaemon(true);
            return t;
        });
        client.setCallback(this);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Connect, subscribe and start delivering messages to {@code sink}.
     *
     * @param sink receiver of inbound messages
     * @return {@code true} if the first round of attempts connected
     */
    public boolean start(ReadingSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        boolean connected = connectWithRetry();
        if (!connected) {
            scheduleReconnect();
        }
        return connected;
    }

    /**
     * One round of up to {@code connectAttempts} connect-and-subscribe
     * attempts.
     *
     * @return {@code true} once connected and subscribed
     */
    boolean connectWithRetry() {
        long backoff = config.getBackoffMs();
        MqttException last = null;
        for (int attempt = 1; attempt <= config.getConnectAttempts() && !closed.get(); attempt++) {
            try {
                connectAndSubscribe();
                monitor.recordConnectivityRestored();
                LOG.info("Connected to MQTT broker {} and subscribed to {}", config.getBrokerUrl(),
                        config.getTopics());
                return true;
            } catch (MqttException e) {
                last = e;
                LOG.warn("MQTT connect attempt {}/{} to {} failed: {}", attempt, config.getConnectAttempts(),
                        config.getBrokerUrl(), e.getMessage());
                if (attempt < config.getConnectAttempts() && !sleep(backoff)) {
                    break;
                }
                backoff = Math.min(backoff * 2, config.getMaxBackoffMs());
            }
        }
        String detail = "broker " + config.getBrokerUrl() + " unreachable after "
                + config.getConnectAttempts() + " attempt(s)"
                + (last != null ? ": " + last.getMessage() : "");
        monitor.recordConnectivityLost(detail);
        return false;
    }

    private void connectAndSubscribe() throws MqttException {
        if (!client.isConnected()) {
            MqttConnectOptions options = new MqttConnectOptions();
            options.setCleanSession(true);
            options.setAutomaticReconnect(false);
            options.setConnectionTimeout(10);
            client.connect(options);
        }
        List<String> topics = config.getTopics();
        int[] qos = new int[topics.size()];
        Arrays.fill(qos, config.getQos());
        client.subscribe(topics.toArray(new String[0]), qos);
    }

    private void scheduleReconnect() {
        if (closed.get() || !reconnecting.compareAndSet(false, true)) {
            return;
        }
        try {
            reconnector.schedule(this::reconnect, config.getMaxBackoffMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            reconnecting.set(false);
            LOG.debug("Reconnect not scheduled, transport is closing");
        }
    }

    private void reconnect() {
        reconnecting.set(false);
        if (closed.get()) {
            return;
        }
        if (!connectWithRetry()) {
            scheduleReconnect();
        }
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stop reconnecting and disconnect. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        reconnector.shutdownNow();
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
            LOG.info("MQTT transport closed");
        } catch (MqttException e) {
            LOG.warn("Error while closing MQTT client: {}", e.getMessage(), e);
        }
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    // ---------------------------------------------------------------
    // MqttCallback
    // ---------------------------------------------------------------

    @Override
    public void connectionLost(Throwable cause) {
        if (closed.get()) {
            return;
        }
        LOG.warn("Disconnected from MQTT broker {}: {}", config.getBrokerUrl(),
                cause != null ? cause.getMessage() : "unknown cause");
        if (reconnecting.compareAndSet(false, true)) {
            try {
                reconnector.execute(this::reconnect);
            } catch (RejectedExecutionException e) {
                reconnecting.set(false);
                LOG.debug("Reconnect not started, transport is closing");
            }
        }
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        ReadingSink target = sink;
        if (target == null) {
            LOG.debug("Message on [{}] before start – ignoring", topic);
            return;
        }
        try {
            if (!target.submit(topic, message.getPayload())) {
                LOG.debug("Reading on [{}] dropped by the pipeline", topic);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to hand message on [{}] to the pipeline", topic, e);
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        LOG.trace("Delivery complete for message {}", token.getMessageId());
    }

    // ---------------------------------------------------------------
    // MessagePublisher
    // ---------------------------------------------------------------

    @Override
    public void publish(String topic, byte[] payload, int qos) throws MqttException {
        if (!client.isConnected()) {
            throw new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED);
        }
        client.publish(topic, payload, qos, false);
    }
}
