/* (C)2026 */
package com.ammann.egress.pipeline;

import com.ammann.egress.exception.EgressException;
import jakarta.enterprise.context.ApplicationScoped;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Validates the egress request and builds a {@link CommandEgressPipeline} for it.
 *
 * <p>Problems with the request are {@code USER} errors and end up in the status service. A job
 * directory the process cannot write to is a {@code FATAL} host problem.
 */
@ApplicationScoped
public class CommandPipelineFactory implements PipelineFactory {

    private static final Logger LOG = Logger.getLogger(CommandPipelineFactory.class);
    static final Set<String> SUPPORTED_SCHEMES = Set.of("rtmp", "rtmps", "srt", "file", "s3");

    @ConfigProperty(name = "egress.handler.pipeline.eos-sequence", defaultValue = "q")
    String eosSequence;

    public CommandPipelineFactory() {}

    CommandPipelineFactory(String eosSequence) {
        this.eosSequence = eosSequence;
    }

    @Override
    public EgressPipeline create(PipelineConfig config) {
        if (!Files.isDirectory(config.tmpDir()) || !Files.isWritable(config.tmpDir())) {
            throw EgressException.fatal(
                    "job directory is not writable: " + config.tmpDir(), null);
        }
        if (config.request().command().isEmpty()) {
            throw EgressException.user("pipeline command is required");
        }
        if (config.request().outputs().isEmpty()) {
            throw EgressException.user("at least one output is required");
        }
        for (String output : config.request().outputs()) {
            validateOutput(output);
        }

        LOG.debugf(
                "Creating command pipeline for egress %s with %d outputs",
                config.egressId(), config.request().outputs().size());
        return new CommandEgressPipeline(config, eosSequence);
    }

    private static void validateOutput(String output) {
        URI uri;
        try {
            uri = new URI(output);
        } catch (URISyntaxException e) {
            throw EgressException.user("malformed output url: " + output, e);
        }
        if (uri.getScheme() == null || !SUPPORTED_SCHEMES.contains(uri.getScheme().toLowerCase())) {
            throw EgressException.user("unsupported output url: " + output);
        }
    }
}
