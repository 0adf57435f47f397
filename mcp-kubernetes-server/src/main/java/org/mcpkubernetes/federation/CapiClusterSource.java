package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import java.util.List;
import java.util.Optional;
import org.mcpkubernetes.discovery.ClusterSummary;
import org.mcpkubernetes.discovery.ClusterSummaryMapper;

/**
 * Lists CAPI {@code Cluster} objects on the management cluster with whatever client it is given.
 */
public class CapiClusterSource {

    private final ResourceDefinitionContext clusterContext;

    public CapiClusterSource(ResourceDefinitionContext clusterContext) {
        this.clusterContext = clusterContext;
    }

    public List<GenericKubernetesResource> listRaw(KubernetesClient client) {
        try {
            GenericKubernetesResourceList list = client.genericKubernetesResources(clusterContext)
                    .inAnyNamespace()
                    .list();
            return list == null || list.getItems() == null ? List.of() : list.getItems();
        } catch (KubernetesClientException e) {
            boolean crdMissing = e.getCode() == 404;
            throw new ClusterDiscoveryException(e.getMessage(), crdMissing, e);
        }
    }

    public List<ClusterSummary> list(KubernetesClient client) {
        return listRaw(client).stream()
                .map(ClusterSummaryMapper::toSummary)
                .toList();
    }

    public Optional<GenericKubernetesResource> findByName(KubernetesClient client, String name) {
        return listRaw(client).stream()
                .filter(cluster -> cluster.getMetadata() != null && name.equals(cluster.getMetadata().getName()))
                .findFirst();
    }
}
