package org.mcpkubernetes.discovery;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a health verdict from a cluster status snapshot.
 * <p>
 * The verdict is decided in order: a deleting cluster is {@link HealthStatus#UNKNOWN}, a provisioning one
 * {@link HealthStatus#DEGRADED}, a ready one {@link HealthStatus#HEALTHY}. Otherwise the number of unhealthy
 * components among control plane and infrastructure decides. A cluster that is not ready while both components
 * report ready stays {@link HealthStatus#UNKNOWN}; node-level problems are not visible in the snapshot.
 */
public final class ClusterHealthEvaluator {

    private ClusterHealthEvaluator() {
    }

    public static HealthReport evaluate(ClusterSummary cluster) {
        HealthComponents components = new HealthComponents(
                ComponentHealth.of(cluster.controlPlaneReady(), "Control plane is ready", "Control plane is not ready"),
                ComponentHealth.of(cluster.infrastructureReady(), "Infrastructure is ready",
                        "Infrastructure is not ready"),
                nodes(cluster));

        HealthStatus status;
        String message;
        if (ClusterSummary.PHASE_DELETING.equals(cluster.phase())) {
            status = HealthStatus.UNKNOWN;
            message = "Cluster is being deleted";
        } else if (ClusterSummary.PHASE_PROVISIONING.equals(cluster.phase())) {
            status = HealthStatus.DEGRADED;
            message = "Cluster is still provisioning";
        } else if (cluster.ready()) {
            status = HealthStatus.HEALTHY;
            message = "Cluster is healthy and ready";
        } else {
            int unhealthy = 0;
            if (components.controlPlane().status() == ComponentHealth.Status.UNHEALTHY) {
                unhealthy++;
            }
            if (components.infrastructure().status() == ComponentHealth.Status.UNHEALTHY) {
                unhealthy++;
            }
            if (unhealthy >= 2) {
                status = HealthStatus.UNHEALTHY;
                message = "Multiple components are unhealthy";
            } else if (unhealthy == 1) {
                status = HealthStatus.DEGRADED;
                message = "One or more components are not ready";
            } else {
                status = HealthStatus.UNKNOWN;
                message = "Unable to determine cluster health";
            }
        }
        return new HealthReport(cluster.name(), status, message, components, checks(cluster));
    }

    private static ComponentHealth nodes(ClusterSummary cluster) {
        Integer count = cluster.nodeCount();
        if (count != null && count > 0) {
            return new ComponentHealth(ComponentHealth.Status.HEALTHY, count, count, count + " node(s) ready");
        }
        return new ComponentHealth(ComponentHealth.Status.UNKNOWN, null, null, "Node count unavailable");
    }

    private static List<HealthCheck> checks(ClusterSummary cluster) {
        List<HealthCheck> checks = new ArrayList<>(4);
        checks.add(cluster.controlPlaneReady()
                ? new HealthCheck("control-plane-ready", HealthCheck.Result.PASS, "Control plane is ready")
                : new HealthCheck("control-plane-ready", HealthCheck.Result.FAIL, "Control plane is not ready"));
        checks.add(cluster.infrastructureReady()
                ? new HealthCheck("infrastructure-ready", HealthCheck.Result.PASS, "Infrastructure is ready")
                : new HealthCheck("infrastructure-ready", HealthCheck.Result.FAIL, "Infrastructure is not ready"));
        checks.add(phaseCheck(cluster.phase()));
        Integer count = cluster.nodeCount();
        checks.add(count != null && count > 0
                ? new HealthCheck("nodes", HealthCheck.Result.PASS, count + " worker node(s) detected")
                : new HealthCheck("nodes", HealthCheck.Result.WARN, "No worker node information available"));
        return List.copyOf(checks);
    }

    private static HealthCheck phaseCheck(String phase) {
        return switch (phase) {
            case ClusterSummary.PHASE_PROVISIONED ->
                    new HealthCheck("cluster-phase", HealthCheck.Result.PASS, "Cluster is provisioned");
            case ClusterSummary.PHASE_PROVISIONING ->
                    new HealthCheck("cluster-phase", HealthCheck.Result.WARN, "Cluster is still provisioning");
            case ClusterSummary.PHASE_DELETING ->
                    new HealthCheck("cluster-phase", HealthCheck.Result.WARN, "Cluster is being deleted");
            case ClusterSummary.PHASE_FAILED ->
                    new HealthCheck("cluster-phase", HealthCheck.Result.FAIL, "Cluster is in failed state");
            default -> new HealthCheck("cluster-phase", HealthCheck.Result.WARN, "Cluster phase: " + phase);
        };
    }
}
