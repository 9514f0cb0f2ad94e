/* (C)2026 */
package com.ammann.egress.profiling;

/**
 * Process-wide profiling capture.
 */
public interface Profiler {

    /**
     * Captures a profile of this process.
     *
     * @param profileName which profile to record
     * @param timeoutSeconds how long to record for
     * @param debugLevel 0 for the raw capture, greater than 0 for a human readable summary
     * @return capture bytes
     * @throws com.ammann.egress.exception.EgressException if the capture cannot be produced
     */
    byte[] capture(String profileName, int timeoutSeconds, int debugLevel);
}
