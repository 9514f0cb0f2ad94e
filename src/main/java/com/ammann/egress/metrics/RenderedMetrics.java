/* (C)2026 */
package com.ammann.egress.metrics;

/**
 * Result of a metrics render.
 *
 * @param text every metric family in Prometheus text exposition format
 * @param count number of samples rendered
 */
public record RenderedMetrics(String text, int count) {}
