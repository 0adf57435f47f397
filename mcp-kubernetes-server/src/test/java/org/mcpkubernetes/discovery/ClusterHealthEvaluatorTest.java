package org.mcpkubernetes.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mcpkubernetes.discovery.Clusters.status;

import org.junit.jupiter.api.Test;

class ClusterHealthEvaluatorTest {

    @Test
    void deletingClusterIsUnknown() {
        HealthReport report = ClusterHealthEvaluator.evaluate(status("Deleting", true, true, true, 3));

        assertThat(report.status()).isEqualTo(HealthStatus.UNKNOWN);
        assertThat(report.message()).isEqualTo("Cluster is being deleted");
    }

    @Test
    void provisioningClusterIsDegraded() {
        HealthReport report = ClusterHealthEvaluator.evaluate(status("Provisioning", false, false, false, null));

        assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void readyClusterIsHealthy() {
        HealthReport report = ClusterHealthEvaluator.evaluate(status("Provisioned", true, true, true, 3));

        assertThat(report.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.message()).isEqualTo("Cluster is healthy and ready");
        assertThat(report.components().nodes().ready()).isEqualTo(3);
        assertThat(report.checks())
                .extracting(HealthCheck::name, HealthCheck::status)
                .containsExactly(
                        tuple("control-plane-ready", HealthCheck.Result.PASS),
                        tuple("infrastructure-ready", HealthCheck.Result.PASS),
                        tuple("cluster-phase", HealthCheck.Result.PASS),
                        tuple("nodes", HealthCheck.Result.PASS));
    }

    @Test
    void bothComponentsDownIsUnhealthy() {
        HealthReport report = ClusterHealthEvaluator.evaluate(status("Failed", false, false, false, null));

        assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(report.message()).isEqualTo("Multiple components are unhealthy");
        assertThat(report.components().controlPlane().status()).isEqualTo(ComponentHealth.Status.UNHEALTHY);
        assertThat(report.components().nodes().status()).isEqualTo(ComponentHealth.Status.UNKNOWN);
        assertThat(report.checks()).filteredOn(check -> check.name().equals("cluster-phase"))
                .singleElement()
                .satisfies(check -> assertThat(check.message()).isEqualTo("Cluster is in failed state"));
    }

    @Test
    void oneComponentDownIsDegraded() {
        HealthReport report = ClusterHealthEvaluator.evaluate(status("Provisioned", false, true, false, 3));

        assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(report.message()).isEqualTo("One or more components are not ready");
    }

    @Test
    void notReadyWithoutAnExplanationStaysUnknown() {
        HealthReport report = ClusterHealthEvaluator.evaluate(status("Pending", false, true, true, null));

        assertThat(report.status()).isEqualTo(HealthStatus.UNKNOWN);
        assertThat(report.message()).isEqualTo("Unable to determine cluster health");
        assertThat(report.checks()).filteredOn(check -> check.name().equals("cluster-phase"))
                .singleElement()
                .satisfies(check -> assertThat(check.message()).isEqualTo("Cluster phase: Pending"));
    }
}
