/* (C)2026 */
package com.ammann.egress.dto;

import java.util.List;

/**
 * What the handler was asked to run: the source room, the destinations and the media command
 * line that produces them.
 */
public record EgressRequest(String roomName, List<String> outputs, List<String> command) {

    public EgressRequest {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        command = command == null ? List.of() : List.copyOf(command);
    }
}
