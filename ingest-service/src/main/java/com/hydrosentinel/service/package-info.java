/**
 * Runnable Hydro Sentinel service.
 *
 * <p>
 * This package wires the core pipeline to an MQTT broker: sensor readings
 * are consumed from the sensor topics, anomalies and performance alerts are
 * published back, and an HTTP endpoint exposes health and metrics.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.hydrosentinel.service.SentinelService} — main entry
 * point</li>
 * <li>{@link com.hydrosentinel.service.MqttTransport} — Paho client,
 * subscriptions and reconnects</li>
 * <li>{@link com.hydrosentinel.service.ServiceConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.hydrosentinel.service.HealthServer} — HTTP health, readiness
 * and metrics endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.hydrosentinel.service;
