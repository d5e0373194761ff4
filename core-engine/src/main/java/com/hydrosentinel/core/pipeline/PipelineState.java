package com.hydrosentinel.core.pipeline;

/**
 * Lifecycle of a {@link PipelineCoordinator}:
 * {@code STOPPED → STARTING → RUNNING → DRAINING → STOPPED}.
 *
 * @since 1.0.0
 */
public enum PipelineState {
    STOPPED,
    STARTING,
    RUNNING,
    /** No new readings accepted; buffered readings are still processed. */
    DRAINING
}
