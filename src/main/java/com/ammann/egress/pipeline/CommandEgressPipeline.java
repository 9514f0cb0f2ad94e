/* (C)2026 */
package com.ammann.egress.pipeline;

import com.ammann.egress.dto.UpdateStreamRequest;
import com.ammann.egress.enumeration.EgressStatus;
import com.ammann.egress.exception.EgressException;
import com.ammann.egress.model.EgressInfo;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Pipeline backed by an external media process (ffmpeg, gst-launch and the like).
 *
 * <p>End of stream is requested by writing the configured EOS sequence to the process stdin,
 * which is how those tools are asked to flush and finalize their outputs. Process output goes to
 * {@code pipeline.log} in the job directory.
 *
 * <p>Exit classification:
 * <ul>
 *   <li>exit 0: COMPLETE</li>
 *   <li>exit 255 after EOS (graceful quit of ffmpeg): COMPLETE</li>
 *   <li>anything else: FAILED with the exit code</li>
 * </ul>
 */
public class CommandEgressPipeline implements EgressPipeline {

    private static final Logger LOG = Logger.getLogger(CommandEgressPipeline.class);
    static final String LOG_FILE = "pipeline.log";
    private static final int GRACEFUL_QUIT_EXIT_CODE = 255;

    private final List<String> command;
    private final Path workDir;
    private final String eosSequence;
    private final EgressInfo info;

    private final Object lock = new Object();
    private Process process;
    private boolean eosRequested;
    private boolean eosWritten;
    private boolean ran;

    public CommandEgressPipeline(PipelineConfig config, String eosSequence) {
        this.command = config.request().command();
        this.workDir = config.tmpDir();
        this.eosSequence = eosSequence;
        this.info = config.initialInfo();
    }

    @Override
    public EgressInfo run() {
        ProcessBuilder builder =
                new ProcessBuilder(command)
                        .directory(workDir.toFile())
                        .redirectErrorStream(true)
                        .redirectOutput(workDir.resolve(LOG_FILE).toFile());

        Process started;
        synchronized (lock) {
            if (ran) {
                throw new IllegalStateException("pipeline has already been run");
            }
            ran = true;
            try {
                started = builder.start();
            } catch (IOException e) {
                LOG.errorf(e, "Failed to start pipeline process for egress %s", info.getEgressId());
                info.fail("failed to start pipeline: " + e.getMessage(), Instant.now());
                return info.snapshot();
            }
            process = started;
            info.transition(EgressStatus.EGRESS_ACTIVE, Instant.now());
            LOG.infof(
                    "Pipeline started for egress %s (pid %d)", info.getEgressId(), started.pid());
            if (eosRequested) {
                writeEos();
            }
        }

        int exitCode;
        try {
            exitCode = started.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            started.destroyForcibly();
            info.setError("pipeline interrupted");
            info.transition(EgressStatus.EGRESS_ABORTED, Instant.now());
            return info.snapshot();
        }

        boolean afterEos;
        synchronized (lock) {
            afterEos = eosWritten;
        }
        Instant now = Instant.now();
        if (exitCode == 0 || (afterEos && exitCode == GRACEFUL_QUIT_EXIT_CODE)) {
            info.transition(EgressStatus.EGRESS_COMPLETE, now);
            LOG.infof("Pipeline for egress %s completed (exit %d)", info.getEgressId(), exitCode);
        } else {
            info.fail("pipeline exited with code " + exitCode, now);
            LOG.warnf("Pipeline for egress %s failed (exit %d)", info.getEgressId(), exitCode);
        }
        return info.snapshot();
    }

    @Override
    public void sendEos() {
        synchronized (lock) {
            if (eosRequested) {
                return;
            }
            eosRequested = true;
            if (process != null) {
                writeEos();
            }
        }
    }

    // Caller holds lock.
    private void writeEos() {
        if (info.getStatus() == EgressStatus.EGRESS_ACTIVE) {
            info.transition(EgressStatus.EGRESS_ENDING, Instant.now());
        }
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.write(eosSequence.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
            stdin.close();
            eosWritten = true;
            LOG.infof("EOS sent to pipeline for egress %s", info.getEgressId());
        } catch (IOException e) {
            // stdin already closed: the process is exiting on its own
            LOG.warnf("Could not send EOS to egress %s: %s", info.getEgressId(), e.getMessage());
        }
    }

    @Override
    public void updateStream(UpdateStreamRequest request) {
        throw EgressException.user("stream updates are not supported by command pipelines");
    }

    @Override
    public String debugDot() {
        Process current;
        synchronized (lock) {
            current = process;
        }
        EgressInfo snapshot = info.snapshot();

        StringBuilder dot = new StringBuilder();
        dot.append("digraph egress {\n");
        dot.append("  rankdir=LR;\n");
        String source = "room_" + escape(snapshot.getRoomName());
        dot.append(String.format("  \"%s\" [shape=box];%n", source));

        String processLabel;
        if (current == null) {
            processLabel = "not started";
        } else {
            String uptime =
                    current.info()
                            .startInstant()
                            .map(start -> Duration.between(start, Instant.now()).toSeconds() + "s")
                            .orElse("unknown");
            processLabel =
                    String.format(
                            "pid %d\\n%s\\nuptime %s",
                            current.pid(), current.isAlive() ? "alive" : "exited", uptime);
        }
        dot.append(
                String.format(
                        "  \"pipeline\" [label=\"%s\\n%s\\n%s\"];%n",
                        escape(command.isEmpty() ? "" : command.get(0)),
                        snapshot.getStatus(),
                        processLabel));
        dot.append(String.format("  \"%s\" -> \"pipeline\";%n", source));
        for (String output : snapshot.getOutputs()) {
            dot.append(String.format("  \"pipeline\" -> \"%s\";%n", escape(output)));
        }
        dot.append("}\n");
        return dot.toString();
    }

    @Override
    public EgressInfo info() {
        return info.snapshot();
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\"", "\\\"");
    }
}
