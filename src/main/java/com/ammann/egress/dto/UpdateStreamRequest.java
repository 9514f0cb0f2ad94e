/* (C)2026 */
package com.ammann.egress.dto;

import java.util.List;

/**
 * Request to change the stream outputs of a running egress.
 * <p>
 * Received on the {@code update_stream} bus topic.
 */
public record UpdateStreamRequest(
        String egressId, List<String> addOutputUrls, List<String> removeOutputUrls) {

    public UpdateStreamRequest {
        addOutputUrls = addOutputUrls == null ? List.of() : List.copyOf(addOutputUrls);
        removeOutputUrls = removeOutputUrls == null ? List.of() : List.copyOf(removeOutputUrls);
    }
}
