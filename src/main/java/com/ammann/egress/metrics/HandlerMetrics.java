/* (C)2026 */
package com.ammann.egress.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

/**
 * Counters describing the handler's own activity.
 * Safe to use without a registry: every increment is then a no-op.
 */
public class HandlerMetrics {

    private static final Logger LOG = Logger.getLogger(HandlerMetrics.class);

    private final Counter killSignalsCounter;
    private final Counter stopRequestsCounter;
    private final Counter updateRequestsCounter;
    private final Counter statusReportFailuresCounter;
    private final Counter debugTimeoutsCounter;

    public HandlerMetrics(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - handler metrics disabled");
            killSignalsCounter = null;
            stopRequestsCounter = null;
            updateRequestsCounter = null;
            statusReportFailuresCounter = null;
            debugTimeoutsCounter = null;
            return;
        }

        killSignalsCounter =
                Counter.builder("egress_handler_kill_signals_total")
                        .description("Kill signals that reached the run loop")
                        .register(meterRegistry);
        stopRequestsCounter =
                Counter.builder("egress_handler_stop_requests_total")
                        .description("StopEgress requests received over the bus")
                        .register(meterRegistry);
        updateRequestsCounter =
                Counter.builder("egress_handler_update_requests_total")
                        .description("UpdateStream requests received over the bus")
                        .register(meterRegistry);
        statusReportFailuresCounter =
                Counter.builder("egress_handler_status_report_failures_total")
                        .description("Status updates the status service did not acknowledge")
                        .register(meterRegistry);
        debugTimeoutsCounter =
                Counter.builder("egress_handler_debug_timeouts_total")
                        .description("Pipeline debug snapshots that exceeded their deadline")
                        .register(meterRegistry);
    }

    /** Registry-less instance for tests and tools. */
    public static HandlerMetrics disabled() {
        return new HandlerMetrics(null);
    }

    public void killSignal() {
        increment(killSignalsCounter);
    }

    public void stopRequest() {
        increment(stopRequestsCounter);
    }

    public void updateRequest() {
        increment(updateRequestsCounter);
    }

    public void statusReportFailure() {
        increment(statusReportFailuresCounter);
    }

    public void debugTimeout() {
        increment(debugTimeoutsCounter);
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
