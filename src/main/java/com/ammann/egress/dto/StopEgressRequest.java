/* (C)2026 */
package com.ammann.egress.dto;

/**
 * Request to end an egress gracefully.
 */
public record StopEgressRequest(String egressId) {}
