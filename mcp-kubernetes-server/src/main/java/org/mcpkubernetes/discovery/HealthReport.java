package org.mcpkubernetes.discovery;

import java.util.List;

public record HealthReport(String name, HealthStatus status, String message, HealthComponents components,
        List<HealthCheck> checks) {
}
