/* (C)2026 */
package com.ammann.egress.handler;

import com.ammann.egress.model.EgressInfo;
import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Ties the handler of this process to the Quarkus lifecycle.
 *
 * <p>On shutdown (SIGTERM, SIGINT) the handler is killed and the observer blocks until
 * {@link EgressHandler#run()} has returned, so the final status report and the surface teardown
 * happen before Quarkus closes Vert.x. The wait is bounded by
 * {@code egress.handler.shutdown-timeout}.
 */
@ApplicationScoped
public class EgressLifecycle {

    private static final Logger LOG = Logger.getLogger(EgressLifecycle.class);

    @ConfigProperty(name = "egress.handler.shutdown-timeout", defaultValue = "30s")
    Duration shutdownTimeout;

    private final AtomicReference<EgressHandler> current = new AtomicReference<>();
    private final CompletableFuture<EgressInfo> finished = new CompletableFuture<>();
    private volatile boolean shutdownRequested;

    public EgressLifecycle() {}

    EgressLifecycle(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Runs {@code handler} to completion. A shutdown that arrived before this call kills the
     * handler straight away.
     */
    public EgressInfo run(EgressHandler handler) {
        if (!current.compareAndSet(null, handler)) {
            throw new IllegalStateException("a handler is already running in this process");
        }
        if (shutdownRequested) {
            handler.kill();
        }
        try {
            EgressInfo result = handler.run();
            finished.complete(result);
            return result;
        } catch (RuntimeException e) {
            finished.completeExceptionally(e);
            throw e;
        }
    }

    void onShutdown(@Observes ShutdownEvent event) {
        shutdownRequested = true;
        EgressHandler handler = current.get();
        if (handler == null || finished.isDone()) {
            return;
        }

        LOG.infof("Shutdown requested, stopping egress %s", handler.egressId());
        handler.kill();
        try {
            finished.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.infof("Egress %s stopped before shutdown", handler.egressId());
        } catch (TimeoutException e) {
            LOG.warnf(
                    "Egress %s did not stop within %s, continuing shutdown",
                    handler.egressId(), shutdownTimeout);
        } catch (ExecutionException e) {
            LOG.warnf("Egress %s ended with an error: %s", handler.egressId(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted while waiting for egress %s to stop", handler.egressId());
        }
    }
}
