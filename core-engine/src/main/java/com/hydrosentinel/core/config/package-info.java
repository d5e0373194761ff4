/**
 * Configuration loading and validation for the Hydro Sentinel pipeline.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.hydrosentinel.core.config.PipelineConfigLoader} into a
 * {@link com.hydrosentinel.core.config.PipelineConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.config;
