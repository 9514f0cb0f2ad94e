/* (C)2026 */
package com.ammann.egress.metrics;

import com.ammann.egress.exception.EgressException;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.exporter.common.TextFormat;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Renders the process metric registry in the Prometheus text exposition format.
 *
 * <p>Families are written one at a time, in enumeration order. The first family that fails to
 * serialize aborts the render: callers get an error, never a truncated body.
 */
public class MetricsRenderer {

    private static final Logger LOG = Logger.getLogger(MetricsRenderer.class);

    /**
     * Serializes a single metric family.
     */
    @FunctionalInterface
    public interface FamilyEncoder {
        void write(Writer writer, MetricFamilySamples family) throws IOException;
    }

    static final FamilyEncoder TEXT_004 =
            (writer, family) -> TextFormat.write004(writer, Collections.enumeration(List.of(family)));

    private final Supplier<Enumeration<MetricFamilySamples>> gatherer;
    private final FamilyEncoder encoder;

    public MetricsRenderer(
            Supplier<Enumeration<MetricFamilySamples>> gatherer, FamilyEncoder encoder) {
        this.gatherer = gatherer;
        this.encoder = encoder;
    }

    public MetricsRenderer(Supplier<Enumeration<MetricFamilySamples>> gatherer) {
        this(gatherer, TEXT_004);
    }

    /**
     * Renderer over everything registered in {@code registry}.
     */
    public static MetricsRenderer forRegistry(PrometheusMeterRegistry registry) {
        return new MetricsRenderer(() -> registry.getPrometheusRegistry().metricFamilySamples());
    }

    /**
     * Gathers the registry and renders it.
     *
     * @throws EgressException of kind INTERNAL if any family fails to serialize
     */
    public RenderedMetrics render() {
        List<MetricFamilySamples> families = Collections.list(gatherer.get());
        LOG.debugf("Rendering metrics from handler process: %d families", families.size());
        return render(families);
    }

    RenderedMetrics render(List<MetricFamilySamples> families) {
        StringWriter writer = new StringWriter();
        int count = 0;
        for (MetricFamilySamples family : families) {
            StringWriter familyWriter = new StringWriter();
            try {
                encoder.write(familyWriter, family);
            } catch (IOException | RuntimeException e) {
                LOG.errorf(e, "Error writing metric family %s", family.name);
                throw EgressException.internal("failed to render metric family " + family.name, e);
            }
            writer.append(familyWriter.getBuffer());
            count += family.samples.size();
        }
        LOG.debugf("Rendered %d metric samples", count);
        return new RenderedMetrics(writer.toString(), count);
    }
}
