/* (C)2026 */
package com.ammann.egress.enumeration;

/**
 * Lifecycle status of an egress.
 * <p>
 * Expected transition sequence is STARTING to ACTIVE, optionally ENDING once an EOS has been
 * requested, and then to exactly one of COMPLETE, FAILED or ABORTED.
 */
public enum EgressStatus {
    /** Egress accepted but the pipeline has not started yet */
    EGRESS_STARTING,
    /** Pipeline is running */
    EGRESS_ACTIVE,
    /** EOS sent, waiting for the pipeline to drain */
    EGRESS_ENDING,
    /** Pipeline finished normally */
    EGRESS_COMPLETE,
    /** Pipeline failed with an error */
    EGRESS_FAILED,
    /** Pipeline was torn down before it could finish */
    EGRESS_ABORTED;

    /**
     * Check if no further transitions are expected.
     *
     * @return true for COMPLETE, FAILED and ABORTED
     */
    public boolean isTerminal() {
        return this == EGRESS_COMPLETE || this == EGRESS_FAILED || this == EGRESS_ABORTED;
    }
}
