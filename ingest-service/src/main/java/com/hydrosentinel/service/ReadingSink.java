package com.hydrosentinel.service;

/**
 * Receives raw transport messages; implemented by
 * {@code PipelineCoordinator::submit}.
 */
@FunctionalInterface
public interface ReadingSink {

    /**
     * @param topic   topic the message arrived on
     * @param payload raw message bytes
     * @return {@code true} if the reading was accepted for processing
     */
    boolean submit(String topic, byte[] payload);
}
