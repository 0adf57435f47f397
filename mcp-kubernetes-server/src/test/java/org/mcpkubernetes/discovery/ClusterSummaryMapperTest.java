package org.mcpkubernetes.discovery;

import static org.assertj.core.api.Assertions.assertThat;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

class ClusterSummaryMapperTest {

    private static GenericKubernetesResource capiCluster(Map<String, Object> spec, Map<String, Object> status) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion("cluster.x-k8s.io/v1beta2");
        resource.setKind("Cluster");
        resource.setMetadata(new ObjectMetaBuilder()
                .withName("prod-wc-01")
                .withNamespace("org-acme")
                .withCreationTimestamp("2025-03-01T10:00:00Z")
                .withLabels(Map.of(ClusterSummary.LABEL_RELEASE, "29.1.0",
                        ClusterSummary.LABEL_ORGANIZATION, "acme"))
                .withAnnotations(Map.of(ClusterSummary.ANNOTATION_DESCRIPTION, "Production workloads"))
                .build());
        if (spec != null) {
            resource.setAdditionalProperty("spec", spec);
        }
        if (status != null) {
            resource.setAdditionalProperty("status", status);
        }
        return resource;
    }

    @Test
    void mapsAProvisionedCluster() {
        ClusterSummary summary = ClusterSummaryMapper.toSummary(capiCluster(
                Map.of("infrastructureRef", Map.of("kind", "AWSCluster"), "topology", Map.of("version", "v1.30.4")),
                Map.of("phase", "Provisioned", "controlPlaneReady", true, "infrastructureReady", true,
                        "workerNodes", 5)));

        assertThat(summary.name()).isEqualTo("prod-wc-01");
        assertThat(summary.namespace()).isEqualTo("org-acme");
        assertThat(summary.provider()).isEqualTo("aws");
        assertThat(summary.release()).isEqualTo("29.1.0");
        assertThat(summary.kubernetesVersion()).isEqualTo("v1.30.4");
        assertThat(summary.ready()).isTrue();
        assertThat(summary.nodeCount()).isEqualTo(5);
        assertThat(summary.createdAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
        assertThat(summary.organization()).isEqualTo("acme");
        assertThat(summary.description()).isEqualTo("Production workloads");
    }

    @Test
    void clusterWithoutStatusIsUnknownAndNotReady() {
        ClusterSummary summary = ClusterSummaryMapper.toSummary(capiCluster(null, null));

        assertThat(summary.phase()).isEqualTo(ClusterSummary.PHASE_UNKNOWN);
        assertThat(summary.ready()).isFalse();
        assertThat(summary.provider()).isEqualTo("unknown");
        assertThat(summary.kubernetesVersion()).isEmpty();
        assertThat(summary.nodeCount()).isNull();
    }

    @Test
    void readyRequiresProvisionedPhase() {
        ClusterSummary summary = ClusterSummaryMapper.toSummary(capiCluster(null,
                Map.of("phase", "Provisioning", "controlPlaneReady", true, "infrastructureReady", true)));

        assertThat(summary.ready()).isFalse();
        assertThat(summary.controlPlaneReady()).isTrue();
    }

    @Test
    void fallsBackToStatusVersionAndReadyReplicas() {
        ClusterSummary summary = ClusterSummaryMapper.toSummary(capiCluster(Map.of(),
                Map.of("phase", "Provisioned", "version", "v1.29.0", "readyReplicas", 2)));

        assertThat(summary.kubernetesVersion()).isEqualTo("v1.29.0");
        assertThat(summary.nodeCount()).isEqualTo(2);
    }

    @ParameterizedTest
    @CsvSource({
            "AWSCluster, aws",
            "AWSManagedCluster, aws",
            "AzureCluster, azure",
            "VSphereCluster, vsphere",
            "GCPCluster, gcp",
            "GoogleManagedCluster, gcp",
            "OpenStackCluster, openstack",
            "DockerCluster, docker"
    })
    void derivesProviderFromInfrastructureKind(String kind, String provider) {
        assertThat(ClusterSummaryMapper.provider(kind)).isEqualTo(provider);
    }

    @Test
    void ageIsCoarse() {
        ClusterSummary summary = Clusters.cluster("prod");
        Instant created = summary.createdAt();

        assertThat(summary.age(created.plusSeconds(30))).isEqualTo("<1m");
        assertThat(summary.age(created.plusSeconds(45 * 60))).isEqualTo("45m");
        assertThat(summary.age(created.plusSeconds(5 * 3600))).isEqualTo("5h");
        assertThat(summary.age(created.plusSeconds(3 * 86400 + 7200))).isEqualTo("3d");
    }
}
