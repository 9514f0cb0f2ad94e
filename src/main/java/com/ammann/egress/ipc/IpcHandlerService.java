/* (C)2026 */
package com.ammann.egress.ipc;

import com.ammann.egress.exception.EgressException;
import com.ammann.egress.exception.GrpcStatusMapper;
import com.ammann.egress.ipc.proto.EgressHandlerGrpc;
import com.ammann.egress.ipc.proto.MetricsRequest;
import com.ammann.egress.ipc.proto.MetricsResponse;
import com.ammann.egress.ipc.proto.PProfRequest;
import com.ammann.egress.ipc.proto.PProfResponse;
import com.ammann.egress.ipc.proto.PipelineDebugDotRequest;
import com.ammann.egress.ipc.proto.PipelineDebugDotResponse;
import com.ammann.egress.metrics.HandlerMetrics;
import com.ammann.egress.metrics.MetricsRenderer;
import com.ammann.egress.metrics.RenderedMetrics;
import com.ammann.egress.pipeline.EgressPipeline;
import com.ammann.egress.profiling.Profiler;
import com.google.protobuf.ByteString;
import io.grpc.stub.StreamObserver;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import java.time.Duration;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * gRPC implementation of the local {@code EgressHandler} IPC protocol.
 *
 * <p>Provides three RPC methods, each independent and safe to call concurrently with each other
 * and with the bus control surface:
 * <ul>
 *   <li>{@code GetPipelineDot} - pipeline graph in DOT format, bounded by the debug timeout</li>
 *   <li>{@code GetPProf} - profiling capture from the {@link Profiler}</li>
 *   <li>{@code GetMetrics} - process metrics in Prometheus text format</li>
 * </ul>
 */
public class IpcHandlerService extends EgressHandlerGrpc.EgressHandlerImplBase {

    private static final Logger LOG = Logger.getLogger(IpcHandlerService.class);

    private final Supplier<EgressPipeline> pipeline;
    private final Profiler profiler;
    private final MetricsRenderer metricsRenderer;
    private final Duration debugTimeout;
    private final HandlerMetrics metrics;

    public IpcHandlerService(
            Supplier<EgressPipeline> pipeline,
            Profiler profiler,
            MetricsRenderer metricsRenderer,
            Duration debugTimeout,
            HandlerMetrics metrics) {
        this.pipeline = pipeline;
        this.profiler = profiler;
        this.metricsRenderer = metricsRenderer;
        this.debugTimeout = debugTimeout;
        this.metrics = metrics;
    }

    /**
     * Requests the DOT graph on a worker thread. If the pipeline does not answer within the
     * debug timeout the caller gets {@code DEADLINE_EXCEEDED}; the late answer is dropped with
     * the cancelled subscription.
     */
    @Override
    public void getPipelineDot(
            PipelineDebugDotRequest request,
            StreamObserver<PipelineDebugDotResponse> responseObserver) {
        EgressPipeline current = pipeline.get();
        if (current == null) {
            responseObserver.onError(
                    GrpcStatusMapper.toStatusException(EgressException.egressNotFound()));
            return;
        }

        Uni.createFrom()
                .item(current::debugDot)
                .onItem()
                .ifNull()
                .continueWith("")
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .ifNoItem()
                .after(debugTimeout)
                .failWith(
                        () -> {
                            metrics.debugTimeout();
                            LOG.warnf("Pipeline debug snapshot timed out after %s", debugTimeout);
                            return EgressException.deadlineExceeded(
                                    "timed out requesting pipeline debug info");
                        })
                .subscribe()
                .with(
                        dot -> {
                            responseObserver.onNext(
                                    PipelineDebugDotResponse.newBuilder().setDotFile(dot).build());
                            responseObserver.onCompleted();
                        },
                        failure ->
                                responseObserver.onError(
                                        GrpcStatusMapper.toStatusException(failure)));
    }

    @Override
    public void getPProf(PProfRequest request, StreamObserver<PProfResponse> responseObserver) {
        if (pipeline.get() == null) {
            responseObserver.onError(
                    GrpcStatusMapper.toStatusException(EgressException.egressNotFound()));
            return;
        }

        byte[] capture;
        try {
            capture =
                    profiler.capture(
                            request.getProfileName(), request.getTimeout(), request.getDebug());
        } catch (RuntimeException e) {
            LOG.warnf("Profile capture %s failed: %s", request.getProfileName(), e.getMessage());
            responseObserver.onError(GrpcStatusMapper.toStatusException(e));
            return;
        }

        responseObserver.onNext(
                PProfResponse.newBuilder().setPprofFile(ByteString.copyFrom(capture)).build());
        responseObserver.onCompleted();
    }

    @Override
    public void getMetrics(MetricsRequest request, StreamObserver<MetricsResponse> responseObserver) {
        RenderedMetrics rendered;
        try {
            rendered = metricsRenderer.render();
        } catch (RuntimeException e) {
            responseObserver.onError(GrpcStatusMapper.toStatusException(e));
            return;
        }

        LOG.debugf("Returning %d metric samples from handler process", rendered.count());
        responseObserver.onNext(MetricsResponse.newBuilder().setMetrics(rendered.text()).build());
        responseObserver.onCompleted();
    }
}
