/* (C)2026 */
package com.ammann.egress.pipeline;

/**
 * Builds the pipeline for the configured egress.
 */
@FunctionalInterface
public interface PipelineFactory {

    /**
     * @throws com.ammann.egress.exception.EgressException of kind {@code USER} if the request is
     *     invalid, or {@code FATAL} if the host cannot run the pipeline
     */
    EgressPipeline create(PipelineConfig config);
}
