/* (C)2026 */
package com.ammann.egress;

import com.ammann.egress.client.IoInfoClient;
import com.ammann.egress.config.ExecutorProducer;
import com.ammann.egress.config.HandlerConfig;
import com.ammann.egress.enumeration.EgressStatus;
import com.ammann.egress.exception.EgressException;
import com.ammann.egress.handler.EgressHandler;
import com.ammann.egress.handler.EgressLifecycle;
import com.ammann.egress.metrics.HandlerMetrics;
import com.ammann.egress.metrics.MetricsRenderer;
import com.ammann.egress.model.EgressInfo;
import com.ammann.egress.pipeline.PipelineConfig;
import com.ammann.egress.pipeline.PipelineFactory;
import com.ammann.egress.profiling.Profiler;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import io.vertx.core.Vertx;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Entry point of an egress handler process.
 *
 * <p>Builds the one {@link EgressHandler} of this process and runs it to completion through
 * {@link EgressLifecycle}, which turns SIGTERM/SIGINT into a graceful kill. Exit code 0 means the egress ended normally, 1 that it
 * failed or never started.
 */
@QuarkusMain
public class EgressHandlerApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(EgressHandlerApplication.class);

    @Inject HandlerConfig handlerConfig;
    @Inject Vertx vertx;
    @Inject IoInfoClient ioClient;
    @Inject PipelineFactory pipelineFactory;
    @Inject Profiler profiler;
    @Inject PrometheusMeterRegistry meterRegistry;
    @Inject EgressLifecycle lifecycle;

    @Inject
    @Named(ExecutorProducer.PIPELINE_EXECUTOR)
    ManagedExecutor pipelineExecutor;

    @Override
    public int run(String... args) {
        PipelineConfig config = handlerConfig.toPipelineConfig();

        EgressHandler handler;
        try {
            handler =
                    EgressHandler.create(
                            config,
                            vertx,
                            ioClient,
                            pipelineFactory,
                            profiler,
                            MetricsRenderer.forRegistry(meterRegistry),
                            new HandlerMetrics(meterRegistry),
                            pipelineExecutor);
        } catch (EgressException e) {
            LOG.errorf("Egress %s could not be started (%s): %s", config.egressId(), e.getKind(), e.getMessage());
            return 1;
        }

        EgressInfo result = lifecycle.run(handler);
        return result.getStatus() == EgressStatus.EGRESS_FAILED ? 1 : 0;
    }

    public static void main(String... args) {
        Quarkus.run(EgressHandlerApplication.class, args);
    }
}
