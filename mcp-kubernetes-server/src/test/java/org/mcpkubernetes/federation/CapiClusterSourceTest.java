package org.mcpkubernetes.federation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Answers.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mcpkubernetes.discovery.ClusterSummary;

class CapiClusterSourceTest {

    private KubernetesClient client;
    private CapiClusterSource source;

    @BeforeEach
    void setUp() {
        client = mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
        source = new CapiClusterSource(CapiResources.CLUSTER_CONTEXT);
    }

    private static GenericKubernetesResource cluster(String name, String namespace) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion("cluster.x-k8s.io/v1beta2");
        resource.setKind("Cluster");
        resource.setMetadata(new ObjectMetaBuilder().withName(name).withNamespace(namespace).build());
        resource.setAdditionalProperty("status", Map.of("phase", "Provisioned"));
        return resource;
    }

    private void givenClusters(GenericKubernetesResource... clusters) {
        GenericKubernetesResourceList list = new GenericKubernetesResourceList();
        list.setItems(List.of(clusters));
        when(client.genericKubernetesResources(CapiResources.CLUSTER_CONTEXT).inAnyNamespace().list()).thenReturn(list);
    }

    @Test
    void listsClustersAcrossNamespaces() {
        givenClusters(cluster("prod", "org-acme"), cluster("dev", "org-beta"));

        assertThat(source.list(client))
                .extracting(ClusterSummary::name, ClusterSummary::namespace, ClusterSummary::phase)
                .containsExactly(
                        tuple("prod", "org-acme", "Provisioned"),
                        tuple("dev", "org-beta", "Provisioned"));
    }

    @Test
    void findsClusterByExactName() {
        givenClusters(cluster("prod", "org-acme"), cluster("prod-2", "org-acme"));

        assertThat(source.findByName(client, "prod")).hasValueSatisfying(
                cluster -> assertThat(cluster.getMetadata().getName()).isEqualTo("prod"));
        assertThat(source.findByName(client, "pro")).isEmpty();
    }

    @Test
    void missingCrdIsFlagged() {
        when(client.genericKubernetesResources(CapiResources.CLUSTER_CONTEXT).inAnyNamespace().list())
                .thenThrow(new KubernetesClientException("the server could not find the requested resource", 404, null));

        assertThatThrownBy(() -> source.list(client))
                .isInstanceOfSatisfying(ClusterDiscoveryException.class, e -> {
                    assertThat(e.crdMissing()).isTrue();
                    assertThat(e.userFacingMessage()).isEqualTo("this management cluster does not have CAPI installed");
                });
    }

    @Test
    void otherApiFailuresAreGeneric() {
        when(client.genericKubernetesResources(CapiResources.CLUSTER_CONTEXT).inAnyNamespace().list())
                .thenThrow(new KubernetesClientException("forbidden", 403, null));

        assertThatThrownBy(() -> source.list(client))
                .isInstanceOfSatisfying(ClusterDiscoveryException.class,
                        e -> assertThat(e.crdMissing()).isFalse());
    }
}
