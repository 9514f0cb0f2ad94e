/* (C)2026 */
package com.ammann.egress.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs the egress pipeline.
 *
 * <p>A handler process runs exactly one pipeline, and the pipeline occupies its thread until it
 * ends, so the executor is sized for one task and nothing queued.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String PIPELINE_EXECUTOR = "egress-pipeline-executor";

    @Produces
    @Named(PIPELINE_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createPipelineExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(1)
                .maxQueued(1)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
