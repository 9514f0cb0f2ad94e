/* (C)2026 */
package com.ammann.egress.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.egress.client.EventBusIoInfoClient;
import com.ammann.egress.client.IoInfoClient;
import com.ammann.egress.pipeline.CommandPipelineFactory;
import com.ammann.egress.pipeline.PipelineConfig;
import com.ammann.egress.pipeline.PipelineFactory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

@QuarkusTest
class HandlerConfigTest {

    @Inject HandlerConfig handlerConfig;
    @Inject PipelineFactory pipelineFactory;
    @Inject IoInfoClient ioClient;

    @Test
    void resolvesPipelineConfigFromProperties() {
        PipelineConfig config = handlerConfig.toPipelineConfig();

        assertThat(config.egressId()).isEqualTo("EG_test");
        assertThat(config.tmpDir())
                .isEqualTo(Path.of(System.getProperty("java.io.tmpdir"), "egress-handler-test", "EG_test"));
        assertThat(config.request().roomName()).isEqualTo("test-room");
        assertThat(config.request().outputs()).containsExactly("file:///tmp/egress-handler-test/out.mp4");
        assertThat(config.debugTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.reportTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void escapedCommaStaysInsideOneCommandArgument() {
        assertThat(handlerConfig.toPipelineConfig().request().command())
                .containsExactly("sh", "-c", "test a,b = a,b");
    }

    @Test
    void wiresDefaultCollaborators() {
        assertThat(pipelineFactory).isInstanceOf(CommandPipelineFactory.class);
        assertThat(ioClient).isInstanceOf(EventBusIoInfoClient.class);
    }
}
