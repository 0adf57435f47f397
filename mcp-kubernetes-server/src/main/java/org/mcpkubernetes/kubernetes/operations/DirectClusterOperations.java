package org.mcpkubernetes.kubernetes.operations;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.mcpkubernetes.federation.ClusterNames;
import org.mcpkubernetes.federation.RequestContext;
import org.mcpkubernetes.identity.Identity;

/**
 * Runs every call with the server's own client. Only the local cluster is reachable.
 */
public class DirectClusterOperations extends AbstractClusterOperations {

    private final KubernetesClient client;

    public DirectClusterOperations(KubernetesClient client, ObjectMapper objectMapper) {
        super(objectMapper);
        this.client = client;
    }

    @Override
    protected KubernetesClient client(RequestContext ctx, Identity identity, String cluster) {
        if (!ClusterNames.isLocal(ClusterNames.normalize(cluster))) {
            throw new UnsupportedOperationException("multi-cluster operations require federation mode to be enabled");
        }
        return client;
    }

    @Override
    public boolean requiresIdentity() {
        return false;
    }
}
