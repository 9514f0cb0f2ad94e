/* (C)2026 */
package com.ammann.egress.client;

import com.ammann.egress.exception.EgressException;
import com.ammann.egress.model.EgressInfo;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.eventbus.ReplyFailure;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Sends egress status updates to the status service over the shared event bus.
 *
 * <p>Each update is a request to {@code egress.handler.io.address}; the stage completes when
 * the service acknowledges it. A timeout or a missing listener fails it with an
 * {@code UNAVAILABLE} {@link EgressException}; a rejection by the service is passed through.
 */
@ApplicationScoped
public class EventBusIoInfoClient implements IoInfoClient {

    private static final Logger LOG = Logger.getLogger(EventBusIoInfoClient.class);
    public static final String DEFAULT_ADDRESS = "io.update_egress";

    private final Vertx vertx;
    private final String address;
    private final Duration sendTimeout;

    @Inject
    public EventBusIoInfoClient(
            Vertx vertx,
            @ConfigProperty(name = "egress.handler.io.address", defaultValue = DEFAULT_ADDRESS)
                    String address,
            @ConfigProperty(name = "egress.handler.report-timeout", defaultValue = "5s")
                    Duration sendTimeout) {
        this.vertx = vertx;
        this.address = address;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public CompletionStage<Void> updateEgress(EgressInfo info) {
        LOG.debugf("Sending status %s for egress %s to %s", info.getStatus(), info.getEgressId(), address);
        DeliveryOptions options = new DeliveryOptions().setSendTimeout(sendTimeout.toMillis());
        return vertx.eventBus()
                .request(address, JsonObject.mapFrom(info), options)
                .<Void>mapEmpty()
                .recover(this::classify)
                .toCompletionStage();
    }

    private Future<Void> classify(Throwable failure) {
        if (failure instanceof ReplyException reply && reply.failureType() != ReplyFailure.RECIPIENT_FAILURE) {
            return Future.failedFuture(
                    EgressException.unavailable("status service unreachable at " + address, failure));
        }
        return Future.failedFuture(failure);
    }
}
