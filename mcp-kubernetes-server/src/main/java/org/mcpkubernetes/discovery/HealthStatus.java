package org.mcpkubernetes.discovery;

public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    DEGRADED,
    UNKNOWN
}
