/* (C)2026 */
package com.ammann.egress.rpc;

import com.ammann.egress.dto.StopEgressRequest;
import com.ammann.egress.dto.UpdateStreamRequest;
import com.ammann.egress.exception.EgressException;
import com.ammann.egress.metrics.HandlerMetrics;
import com.ammann.egress.model.EgressInfo;
import com.ammann.egress.pipeline.EgressPipeline;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Control surface of the handler on the shared event bus.
 *
 * <p>Serves two request/reply topics scoped by the egress id:
 * <ul>
 *   <li>{@code update_stream} - forwards an {@link UpdateStreamRequest} to the pipeline and
 *       replies with the current {@link EgressInfo}</li>
 *   <li>{@code stop_egress} - asks the pipeline for EOS and replies immediately with the current
 *       {@link EgressInfo}, without waiting for the pipeline to finish</li>
 * </ul>
 *
 * <p>Requests arriving while no pipeline exists fail with {@code NOT_FOUND}. Pipeline errors
 * are passed through with the failure code of their {@link EgressException.Kind}. Handlers run
 * on a worker thread so a slow pipeline never blocks the event loop.
 */
public class EgressHandlerRpcServer {

    private static final Logger LOG = Logger.getLogger(EgressHandlerRpcServer.class);
    private static final Duration REGISTRATION_TIMEOUT = Duration.ofSeconds(10);

    private final Vertx vertx;
    private final String egressId;
    private final Supplier<EgressPipeline> pipeline;
    private final HandlerMetrics metrics;
    private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public EgressHandlerRpcServer(
            Vertx vertx, String egressId, Supplier<EgressPipeline> pipeline, HandlerMetrics metrics) {
        this.vertx = vertx;
        this.egressId = egressId;
        this.pipeline = pipeline;
        this.metrics = metrics;
    }

    /**
     * Registers both topics. If either fails, whatever was already registered is unregistered
     * again before the error is thrown.
     *
     * @throws EgressException of kind FATAL if a topic cannot be registered
     */
    public void register() {
        try {
            registerTopic(RpcTopics.updateStream(egressId), this::updateStream);
            registerTopic(RpcTopics.stopEgress(egressId), this::stopEgress);
        } catch (EgressException e) {
            shutdown();
            throw e;
        }
        LOG.infof("Registered control topics for egress %s", egressId);
    }

    private void registerTopic(String address, Function<JsonObject, EgressInfo> operation) {
        CompletableFuture<Void> registered = new CompletableFuture<>();
        MessageConsumer<JsonObject> consumer;
        try {
            consumer = vertx.eventBus().consumer(address, message -> dispatch(message, operation));
        } catch (RuntimeException e) {
            throw EgressException.fatal("failed to register topic " + address, e);
        }
        consumers.add(consumer);
        consumer.completionHandler(
                result -> {
                    if (result.succeeded()) {
                        registered.complete(null);
                    } else {
                        registered.completeExceptionally(result.cause());
                    }
                });

        try {
            registered.get(REGISTRATION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw EgressException.fatal("interrupted while registering topic " + address, e);
        } catch (ExecutionException | TimeoutException e) {
            throw EgressException.fatal("failed to register topic " + address, e);
        }
    }

    private void dispatch(Message<JsonObject> message, Function<JsonObject, EgressInfo> operation) {
        vertx.executeBlocking(() -> operation.apply(message.body()), false)
                .onSuccess(info -> message.reply(JsonObject.mapFrom(info)))
                .onFailure(failure -> reject(message, failure));
    }

    EgressInfo updateStream(JsonObject body) {
        metrics.updateRequest();
        EgressPipeline current = requirePipeline();
        UpdateStreamRequest request = decode(body, UpdateStreamRequest.class);
        requireOwnEgress(request.egressId());

        LOG.debugf("UpdateStream for egress %s: +%s -%s", egressId, request.addOutputUrls(), request.removeOutputUrls());
        current.updateStream(request);
        return current.info();
    }

    EgressInfo stopEgress(JsonObject body) {
        metrics.stopRequest();
        EgressPipeline current = requirePipeline();
        StopEgressRequest request = decode(body, StopEgressRequest.class);
        requireOwnEgress(request.egressId());

        LOG.infof("StopEgress received for egress %s", egressId);
        current.sendEos();
        return current.info();
    }

    private EgressPipeline requirePipeline() {
        EgressPipeline current = pipeline.get();
        if (current == null) {
            throw EgressException.egressNotFound();
        }
        return current;
    }

    // An empty id means "whoever owns this topic".
    private void requireOwnEgress(String requestedId) {
        if (requestedId != null && !requestedId.isEmpty() && !requestedId.equals(egressId)) {
            throw EgressException.notFound("egress " + requestedId + " is not handled here");
        }
    }

    private static <T> T decode(JsonObject body, Class<T> type) {
        JsonObject json = body == null ? new JsonObject() : body;
        try {
            return json.mapTo(type);
        } catch (IllegalArgumentException e) {
            throw EgressException.user("malformed request: " + e.getMessage(), e);
        }
    }

    private void reject(Message<JsonObject> message, Throwable failure) {
        if (failure instanceof EgressException egressException) {
            LOG.debugf("Rejecting %s: %s", message.address(), egressException.getMessage());
            message.fail(egressException.getKind().code(), egressException.getMessage());
            return;
        }
        LOG.errorf(failure, "Unhandled error on %s", message.address());
        message.fail(EgressException.Kind.INTERNAL.code(), String.valueOf(failure.getMessage()));
    }

    /**
     * Unregisters both topics. Later calls are no-ops.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        for (MessageConsumer<JsonObject> consumer : consumers) {
            consumer.unregister()
                    .onFailure(
                            failure ->
                                    LOG.warnf(
                                            "Failed to unregister %s: %s",
                                            consumer.address(), failure.getMessage()));
        }
        consumers.clear();
        LOG.infof("Control topics for egress %s shut down", egressId);
    }
}
