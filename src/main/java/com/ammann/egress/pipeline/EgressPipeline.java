/* (C)2026 */
package com.ammann.egress.pipeline;

import com.ammann.egress.dto.UpdateStreamRequest;
import com.ammann.egress.model.EgressInfo;

/**
 * The managed media job driven by the handler.
 *
 * <p>Implementations own their {@link EgressInfo} while running. All methods other than
 * {@link #run()} may be called from any thread, concurrently with {@code run()}.
 */
public interface EgressPipeline {

    /**
     * Starts the pipeline and blocks until it reaches a terminal state.
     *
     * <p>Called at most once. An EOS requested before or during this call must be honoured
     * before the terminal result is produced.
     *
     * @return snapshot of the terminal descriptor
     */
    EgressInfo run();

    /**
     * Requests a graceful end of stream. Idempotent and non-blocking.
     */
    void sendEos();

    /**
     * Applies an output change to the running pipeline.
     *
     * @throws com.ammann.egress.exception.EgressException if the update is rejected
     */
    void updateStream(UpdateStreamRequest request);

    /**
     * Renders the current pipeline graph in DOT format. May block.
     */
    String debugDot();

    /**
     * Snapshot of the current descriptor.
     */
    EgressInfo info();
}
