package com.celesteos.core.health;

import java.util.Map;

/**
 * Health of one router component, as reported by {@code GET /api/v1/health} and the
 * {@code health} command.
 *
 * @param component {@code patterns} or {@code classifier}
 * @param detail    human-readable summary, e.g. the canary that misrouted
 * @param metadata  table sizes and similar counters; empty when there is nothing to report
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
