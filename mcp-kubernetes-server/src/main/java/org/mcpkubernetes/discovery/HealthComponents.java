package org.mcpkubernetes.discovery;

public record HealthComponents(ComponentHealth controlPlane, ComponentHealth infrastructure, ComponentHealth nodes) {
}
