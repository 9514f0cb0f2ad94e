/* (C)2026 */
package com.ammann.egress.client;

import com.ammann.egress.model.EgressInfo;
import java.util.concurrent.CompletionStage;

/**
 * Status service that tracks egress state outside this process.
 *
 * <p>Callers treat delivery as best effort: a failed stage is logged, never escalated.
 */
public interface IoInfoClient {

    CompletionStage<Void> updateEgress(EgressInfo info);
}
