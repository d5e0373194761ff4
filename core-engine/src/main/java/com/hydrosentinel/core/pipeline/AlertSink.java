package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.model.Alert;

/**
 * External alerting collaborator receiving threshold alerts from the
 * performance monitor.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertSink {

    /**
     * @param alert the alert to publish
     * @throws Exception if publishing failed; the failure is logged and counted
     */
    void publish(Alert alert) throws Exception;
}
