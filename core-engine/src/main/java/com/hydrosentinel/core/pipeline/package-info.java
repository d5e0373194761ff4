/**
 * Pipeline orchestration: the {@link com.hydrosentinel.core.pipeline.PipelineCoordinator}
 * lifecycle, worker pool and the collaborator interfaces for downstream
 * consumers, alerting and auditing.
 */
package com.hydrosentinel.core.pipeline;
