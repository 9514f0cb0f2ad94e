/* (C)2026 */
package com.ammann.egress.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.egress.enumeration.EgressStatus;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class EgressInfoTest {

    @Test
    void newDescriptorIsStarting() {
        EgressInfo info = new EgressInfo("EG_1", "room", List.of("rtmp://host/live"));

        assertThat(info.getStatus()).isEqualTo(EgressStatus.EGRESS_STARTING);
        assertThat(info.getStartedAt()).isNull();
        assertThat(info.getEndedAt()).isNull();
    }

    @Test
    void activeTransitionStampsStartOnce() {
        EgressInfo info = new EgressInfo("EG_1", "room", List.of());
        Instant first = Instant.parse("2026-01-01T00:00:00Z");
        Instant later = first.plusSeconds(30);

        info.transition(EgressStatus.EGRESS_ACTIVE, first);
        info.transition(EgressStatus.EGRESS_ACTIVE, later);

        assertThat(info.getStartedAt()).isEqualTo(first);
        assertThat(info.getUpdatedAt()).isEqualTo(later);
        assertThat(info.getEndedAt()).isNull();
    }

    @Test
    void terminalTransitionStampsEnd() {
        EgressInfo info = new EgressInfo("EG_1", "room", List.of());
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        info.transition(EgressStatus.EGRESS_ACTIVE, start);

        info.transition(EgressStatus.EGRESS_COMPLETE, start.plusSeconds(60));

        assertThat(info.getEndedAt()).isEqualTo(start.plusSeconds(60));
        assertThat(info.getStatus().isTerminal()).isTrue();
    }

    @Test
    void failBeforeStartUsesOneInstantForEveryTimestamp() {
        EgressInfo info = new EgressInfo("EG_1", "room", List.of());
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        info.fail("invalid output", now);

        assertThat(info.getStatus()).isEqualTo(EgressStatus.EGRESS_FAILED);
        assertThat(info.getError()).isEqualTo("invalid output");
        assertThat(info.getStartedAt()).isEqualTo(now);
        assertThat(info.getUpdatedAt()).isEqualTo(now);
        assertThat(info.getEndedAt()).isEqualTo(now);
    }

    @Test
    void snapshotIsDetachedFromLaterUpdates() {
        EgressInfo info = new EgressInfo("EG_1", "room", List.of());
        EgressInfo snapshot = info.snapshot();

        info.transition(EgressStatus.EGRESS_ACTIVE, Instant.now());

        assertThat(snapshot.getStatus()).isEqualTo(EgressStatus.EGRESS_STARTING);
    }

    @Test
    void serializesToJsonForTheBus() {
        EgressInfo info = new EgressInfo("EG_1", "room", List.of("srt://host:9000"));
        info.transition(EgressStatus.EGRESS_ACTIVE, Instant.parse("2026-01-01T00:00:00Z"));

        JsonObject json = JsonObject.mapFrom(info);

        assertThat(json.getString("egressId")).isEqualTo("EG_1");
        assertThat(json.getString("status")).isEqualTo("EGRESS_ACTIVE");
        assertThat(json.getJsonArray("outputs").getString(0)).isEqualTo("srt://host:9000");
        assertThat(json.mapTo(EgressInfo.class).getStartedAt())
                .isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    }
}
