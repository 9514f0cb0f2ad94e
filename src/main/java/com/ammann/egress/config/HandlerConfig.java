/* (C)2026 */
package com.ammann.egress.config;

import com.ammann.egress.dto.EgressRequest;
import com.ammann.egress.pipeline.PipelineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Handler configuration read from MicroProfile Config.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>egress.handler.egress-id (required)</li>
 *   <li>egress.handler.tmp-dir - parent of the job directory</li>
 *   <li>egress.handler.room-name</li>
 *   <li>egress.handler.outputs - comma separated output URLs</li>
 *   <li>egress.handler.pipeline.command - comma separated command line, one argument per
 *       element. A comma inside an argument (ffmpeg filter graphs) is written as {@code \,}</li>
 *   <li>egress.handler.debug-timeout, egress.handler.report-timeout</li>
 * </ul>
 */
@ApplicationScoped
public class HandlerConfig {

    @ConfigProperty(name = "egress.handler.egress-id")
    String egressId;

    @ConfigProperty(name = "egress.handler.tmp-dir", defaultValue = "/tmp/egress")
    String tmpDir;

    @ConfigProperty(name = "egress.handler.room-name")
    Optional<String> roomName;

    @ConfigProperty(name = "egress.handler.outputs")
    Optional<List<String>> outputs;

    @ConfigProperty(name = "egress.handler.pipeline.command")
    Optional<List<String>> command;

    @ConfigProperty(name = "egress.handler.debug-timeout", defaultValue = "2s")
    Duration debugTimeout;

    @ConfigProperty(name = "egress.handler.report-timeout", defaultValue = "5s")
    Duration reportTimeout;

    /**
     * Resolves the configuration of this process's egress. The job directory is
     * {@code <tmp-dir>/<egress-id>}.
     */
    public PipelineConfig toPipelineConfig() {
        EgressRequest request =
                new EgressRequest(
                        roomName.orElse(null), outputs.orElse(List.of()), command.orElse(List.of()));
        return new PipelineConfig(
                egressId, Path.of(tmpDir).resolve(egressId), request, debugTimeout, reportTimeout);
    }
}
