/* (C)2026 */
package com.ammann.egress.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.egress.dto.EgressRequest;
import com.ammann.egress.exception.EgressException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandPipelineFactoryTest {

    @TempDir Path tmpDir;

    private final CommandPipelineFactory factory = new CommandPipelineFactory("q");

    @Test
    void buildsPipelineForValidRequest() {
        EgressPipeline pipeline =
                factory.create(config(tmpDir, List.of("rtmp://live.example/app/key"), List.of("ffmpeg")));

        assertThat(pipeline).isInstanceOf(CommandEgressPipeline.class);
        assertThat(pipeline.info().getEgressId()).isEqualTo("EG_factory");
    }

    @Test
    void missingCommandIsAUserError() {
        assertUserError(config(tmpDir, List.of("rtmp://live.example/app"), List.of()), "command is required");
    }

    @Test
    void missingOutputsIsAUserError() {
        assertUserError(config(tmpDir, List.of(), List.of("ffmpeg")), "at least one output");
    }

    @Test
    void unsupportedSchemeIsAUserError() {
        assertUserError(
                config(tmpDir, List.of("gopher://example/feed"), List.of("ffmpeg")),
                "unsupported output url");
    }

    @Test
    void malformedUrlIsAUserError() {
        assertUserError(
                config(tmpDir, List.of("rtmp://bad host/live"), List.of("ffmpeg")), "malformed output url");
    }

    @Test
    void unusableJobDirectoryIsFatal() {
        PipelineConfig config =
                config(tmpDir.resolve("missing"), List.of("rtmp://live.example/app"), List.of("ffmpeg"));

        assertThatThrownBy(() -> factory.create(config))
                .isInstanceOf(EgressException.class)
                .satisfies(e -> assertThat(((EgressException) e).isFatal()).isTrue());
    }

    private void assertUserError(PipelineConfig config, String message) {
        assertThatThrownBy(() -> factory.create(config))
                .isInstanceOf(EgressException.class)
                .hasMessageContaining(message)
                .satisfies(
                        e -> assertThat(((EgressException) e).getKind())
                                .isEqualTo(EgressException.Kind.USER));
    }

    private static PipelineConfig config(Path dir, List<String> outputs, List<String> command) {
        return new PipelineConfig(
                "EG_factory", dir, new EgressRequest("room", outputs, command), null, null);
    }
}
