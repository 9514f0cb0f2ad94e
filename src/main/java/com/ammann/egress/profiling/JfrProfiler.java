/* (C)2026 */
package com.ammann.egress.profiling;

import com.ammann.egress.exception.EgressException;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import jdk.jfr.Configuration;
import jdk.jfr.Recording;
import jdk.jfr.consumer.RecordedEvent;
import jdk.jfr.consumer.RecordingFile;
import org.jboss.logging.Logger;

/**
 * {@link Profiler} backed by Java Flight Recorder.
 *
 * <p>Profile names map to JFR configurations:
 * <ul>
 *   <li>{@code default} - low overhead continuous settings</li>
 *   <li>{@code profile}, {@code cpu} - higher sampling rates</li>
 * </ul>
 *
 * <p>Debug level 0 returns the {@code .jfr} file; any higher level returns a text summary with
 * one line per event type and its event count.
 */
@ApplicationScoped
public class JfrProfiler implements Profiler {

    private static final Logger LOG = Logger.getLogger(JfrProfiler.class);
    private static final Map<String, String> CONFIGURATIONS =
            Map.of("default", "default", "profile", "profile", "cpu", "profile");
    private static final int MIN_DURATION_SECONDS = 1;

    @Override
    public byte[] capture(String profileName, int timeoutSeconds, int debugLevel) {
        String configurationName = CONFIGURATIONS.get(profileName);
        if (configurationName == null) {
            throw EgressException.user("unknown profile: " + profileName);
        }

        Configuration configuration;
        try {
            configuration = Configuration.getConfiguration(configurationName);
        } catch (IOException | ParseException e) {
            throw EgressException.internal("cannot load JFR configuration " + configurationName, e);
        }

        Duration duration = Duration.ofSeconds(Math.max(MIN_DURATION_SECONDS, timeoutSeconds));
        LOG.infof("Capturing %s profile for %s (debug=%d)", profileName, duration, debugLevel);

        Path dump = null;
        try (Recording recording = new Recording(configuration)) {
            recording.setName("egress-" + profileName);
            recording.start();
            Thread.sleep(duration.toMillis());
            recording.stop();

            dump = Files.createTempFile("egress-profile-", ".jfr");
            recording.dump(dump);
            return debugLevel > 0 ? summarize(dump) : Files.readAllBytes(dump);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw EgressException.internal("profile capture interrupted", e);
        } catch (IOException e) {
            throw EgressException.internal("profile capture failed", e);
        } finally {
            deleteQuietly(dump);
        }
    }

    private static byte[] summarize(Path dump) throws IOException {
        Map<String, Integer> counts = new TreeMap<>();
        for (RecordedEvent event : RecordingFile.readAllEvents(dump)) {
            counts.merge(event.getEventType().getName(), 1, Integer::sum);
        }

        StringBuilder summary = new StringBuilder();
        counts.forEach((type, count) -> summary.append(type).append(' ').append(count).append('\n'));
        return summary.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path dump) {
        if (dump == null) {
            return;
        }
        try {
            Files.deleteIfExists(dump);
        } catch (IOException e) {
            LOG.warnf("Could not delete profile dump %s: %s", dump, e.getMessage());
        }
    }
}
