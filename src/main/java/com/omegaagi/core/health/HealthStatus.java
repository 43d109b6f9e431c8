package com.omegaagi.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of checking one component the interpreter depends on.
 * <p>
 * The backend is required, so only it reports DOWN when missing; the log sink and the
 * interaction database are optional and report DEGRADED instead.
 *
 * @param component name reported under {@code components} by {@code GET /health}
 * @param status    UP, DOWN or DEGRADED
 * @param detail    one-line, secret-free explanation
 * @param metadata  extra facts such as the default model; never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus up(String component, String detail) {
        return up(component, detail, Map.of());
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail) {
        return degraded(component, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * Overall service status: DOWN if any component is down, otherwise UP.
     * A degraded optional component does not take the service down.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        return checks.stream().anyMatch(HealthStatus::isDown) ? Status.DOWN : Status.UP;
    }
}
