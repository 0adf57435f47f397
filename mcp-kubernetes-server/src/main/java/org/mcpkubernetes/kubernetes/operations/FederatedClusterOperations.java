package org.mcpkubernetes.kubernetes.operations;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.mcpkubernetes.federation.ClusterClientManager;
import org.mcpkubernetes.federation.RequestContext;
import org.mcpkubernetes.identity.Identity;

/**
 * Resolves an impersonated client for the caller on the requested cluster for every call.
 */
public class FederatedClusterOperations extends AbstractClusterOperations {

    private final ClusterClientManager manager;

    public FederatedClusterOperations(ClusterClientManager manager, ObjectMapper objectMapper) {
        super(objectMapper);
        this.manager = manager;
    }

    @Override
    protected KubernetesClient client(RequestContext ctx, Identity identity, String cluster) {
        return manager.resolve(ctx, cluster, identity);
    }

    @Override
    public boolean requiresIdentity() {
        return true;
    }
}
