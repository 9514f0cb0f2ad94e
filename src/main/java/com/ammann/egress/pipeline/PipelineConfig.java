/* (C)2026 */
package com.ammann.egress.pipeline;

import com.ammann.egress.dto.EgressRequest;
import com.ammann.egress.model.EgressInfo;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved configuration of the single egress handled by this process.
 *
 * @param egressId unique id; scopes the bus topics
 * @param tmpDir job-scoped temporary directory, holds the IPC socket and pipeline output
 * @param request what to run
 * @param debugTimeout upper bound for a pipeline debug snapshot
 * @param reportTimeout upper bound for delivering a status update
 */
public record PipelineConfig(
        String egressId,
        Path tmpDir,
        EgressRequest request,
        Duration debugTimeout,
        Duration reportTimeout) {

    public static final Duration DEFAULT_DEBUG_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_REPORT_TIMEOUT = Duration.ofSeconds(5);

    public PipelineConfig {
        if (egressId == null || egressId.isBlank()) {
            throw new IllegalArgumentException("egressId is required");
        }
        request = request == null ? new EgressRequest(null, null, null) : request;
        debugTimeout = debugTimeout == null ? DEFAULT_DEBUG_TIMEOUT : debugTimeout;
        reportTimeout = reportTimeout == null ? DEFAULT_REPORT_TIMEOUT : reportTimeout;
    }

    /**
     * Descriptor in its initial STARTING state.
     */
    public EgressInfo initialInfo() {
        return new EgressInfo(egressId, request.roomName(), request.outputs());
    }
}
