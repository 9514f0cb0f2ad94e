/* (C)2026 */
package com.ammann.egress.handler;

import com.ammann.egress.client.IoInfoClient;
import com.ammann.egress.exception.EgressException;
import com.ammann.egress.ipc.IpcHandlerService;
import com.ammann.egress.ipc.IpcServer;
import com.ammann.egress.metrics.HandlerMetrics;
import com.ammann.egress.metrics.MetricsRenderer;
import com.ammann.egress.model.EgressInfo;
import com.ammann.egress.pipeline.EgressPipeline;
import com.ammann.egress.pipeline.PipelineConfig;
import com.ammann.egress.pipeline.PipelineFactory;
import com.ammann.egress.profiling.Profiler;
import com.ammann.egress.rpc.EgressHandlerRpcServer;
import com.ammann.egress.signal.KillSwitch;
import io.vertx.core.Vertx;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.file.Files;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Supervisor of the single egress run by this process.
 *
 * <p>Owns the pipeline, the kill switch and both control surfaces (the event bus topics and
 * the local IPC server). {@link #run()} reconciles the three ways an egress can end (a
 * StopEgress request, a {@link #kill()} and the pipeline finishing on its own) into one
 * shutdown sequence:
 * <ol>
 *   <li>the terminal descriptor is reported to the status service (best effort)</li>
 *   <li>the bus topics are unregistered</li>
 *   <li>the IPC server is stopped</li>
 * </ol>
 *
 * <p>A kill only ever requests a graceful EOS. If the pipeline never honours it, {@code run()}
 * keeps waiting: forcing the pipeline down is the pipeline's own policy.
 */
public final class EgressHandler {

    private static final Logger LOG = Logger.getLogger(EgressHandler.class);

    private final PipelineConfig config;
    private final IoInfoClient ioClient;
    private final HandlerMetrics metrics;
    private final Executor pipelineExecutor;
    private final KillSwitch kill = new KillSwitch();
    private final AtomicReference<EgressPipeline> pipeline = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean surfacesStopped = new AtomicBoolean(false);

    private EgressHandlerRpcServer rpcServer;
    private IpcServer ipcServer;

    private EgressHandler(
            PipelineConfig config,
            IoInfoClient ioClient,
            HandlerMetrics metrics,
            Executor pipelineExecutor) {
        this.config = config;
        this.ioClient = ioClient;
        this.metrics = metrics;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Brings up both control surfaces and builds the pipeline.
     *
     * <p>Failures before the pipeline exists are fatal. A pipeline construction failure of kind
     * {@code USER} is reported to the status service as a failed egress first; any other
     * failure is propagated without a report. Either way the surfaces are torn down again and
     * the error is rethrown unchanged.
     *
     * <p>{@code pipelineExecutor} runs the pipeline; it must have a thread free for the whole
     * lifetime of the egress.
     *
     * @throws EgressException if the handler cannot be constructed
     */
    public static EgressHandler create(
            PipelineConfig config,
            Vertx vertx,
            IoInfoClient ioClient,
            PipelineFactory pipelineFactory,
            Profiler profiler,
            MetricsRenderer metricsRenderer,
            HandlerMetrics metrics,
            Executor pipelineExecutor) {
        EgressHandler handler = new EgressHandler(config, ioClient, metrics, pipelineExecutor);
        LOG.infof("Creating handler for egress %s in %s", config.egressId(), config.tmpDir());

        handler.rpcServer =
                new EgressHandlerRpcServer(vertx, config.egressId(), handler.pipeline::get, metrics);
        try {
            handler.rpcServer.register();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Cannot register control topics for egress %s", config.egressId());
            handler.stopSurfaces();
            throw e;
        }

        try {
            Files.createDirectories(config.tmpDir());
            IpcHandlerService ipcService =
                    new IpcHandlerService(
                            handler.pipeline::get,
                            profiler,
                            metricsRenderer,
                            config.debugTimeout(),
                            metrics);
            handler.ipcServer = IpcServer.start(IpcServer.localAddress(config.tmpDir()), ipcService);
        } catch (IOException e) {
            handler.stopSurfaces();
            throw EgressException.fatal("cannot create job directory " + config.tmpDir(), e);
        } catch (RuntimeException e) {
            handler.stopSurfaces();
            throw e;
        }

        try {
            handler.pipeline.set(pipelineFactory.create(config));
        } catch (EgressException e) {
            if (!e.isFatal()) {
                LOG.warnf("Egress %s rejected: %s", config.egressId(), e.getMessage());
                handler.reportStartFailure(e);
            } else {
                LOG.errorf(e, "Fatal error creating pipeline for egress %s", config.egressId());
            }
            handler.stopSurfaces();
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error creating pipeline for egress %s", config.egressId());
            handler.stopSurfaces();
            throw e;
        }

        return handler;
    }

    private void reportStartFailure(EgressException error) {
        EgressInfo info = config.initialInfo();
        info.fail(error.getMessage(), Instant.now());
        reportStatus(info);
    }

    /**
     * Runs the egress to completion. May be called once.
     *
     * @return the terminal descriptor, as reported to the status service
     * @throws IllegalStateException on a second call
     */
    public EgressInfo run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("handler for egress " + config.egressId() + " has already run");
        }
        EgressPipeline current = pipeline.get();

        CompletableFuture<EgressInfo> result;
        try {
            result = CompletableFuture.supplyAsync(current::run, pipelineExecutor);
        } catch (RejectedExecutionException e) {
            result = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> killed = kill.watch();
        CompletableFuture.anyOf(killed, result.handle((info, failure) -> info)).join();

        if (!result.isDone()) {
            LOG.infof("Kill signal received, sending EOS to egress %s", config.egressId());
            metrics.killSignal();
            current.sendEos();
        }

        EgressInfo terminal;
        try {
            terminal = result.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.errorf(cause, "Pipeline for egress %s failed", config.egressId());
            terminal = current.info();
            terminal.fail(String.valueOf(cause.getMessage()), Instant.now());
        }

        LOG.infof("Egress %s finished with status %s", config.egressId(), terminal.getStatus());
        reportStatus(terminal);
        stopSurfaces();
        return terminal;
    }

    /**
     * Requests a graceful stop of the egress. Safe to call any number of times from any
     * thread, including a JVM shutdown hook; never blocks.
     */
    public void kill() {
        if (kill.trigger()) {
            LOG.infof("Kill requested for egress %s", config.egressId());
        }
    }

    private void reportStatus(EgressInfo info) {
        try {
            ioClient.updateEgress(info)
                    .toCompletableFuture()
                    .get(config.reportTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.statusReportFailure();
            LOG.warnf("Interrupted while reporting status of egress %s", info.getEgressId());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            metrics.statusReportFailure();
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            LOG.warnf(
                    "Failed to report status %s of egress %s: %s",
                    info.getStatus(), info.getEgressId(), cause.getMessage());
        }
    }

    private void stopSurfaces() {
        if (!surfacesStopped.compareAndSet(false, true)) {
            return;
        }
        if (rpcServer != null) {
            rpcServer.shutdown();
        }
        if (ipcServer != null) {
            ipcServer.stop();
        }
    }

    public String egressId() {
        return config.egressId();
    }

    /** Address of the local IPC server, or null if it never started. */
    public SocketAddress ipcAddress() {
        return ipcServer == null ? null : ipcServer.address();
    }

    boolean isKilled() {
        return kill.isTriggered();
    }
}
