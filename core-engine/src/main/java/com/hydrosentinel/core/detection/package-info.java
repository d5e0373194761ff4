/**
 * Anomaly classification of cleaned readings.
 *
 * <p>
 * The pipeline depends only on the
 * {@link com.hydrosentinel.core.detection.AnomalyDetector} interface; the
 * built-in strategy is
 * {@link com.hydrosentinel.core.detection.ZScoreAnomalyDetector}, a z-score
 * rule gated by the {@link com.hydrosentinel.core.detection.QualityScorer}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To plug in another strategy, implement {@code AnomalyDetector} and pass it
 * to the {@link com.hydrosentinel.core.pipeline.PipelineCoordinator} builder.
 * </p>
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.detection;
