package org.mcpkubernetes.kubernetes.operations;

import java.util.Map;
import java.util.Optional;
import org.mcpkubernetes.federation.RequestContext;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.output.ListOptions;
import org.mcpkubernetes.output.PaginatedResult;

/**
 * Read operations against a cluster. Implementations differ only in how they obtain the client.
 */
public interface ClusterOperations {

    Optional<Map<String, Object>> get(RequestContext ctx, Identity identity, String cluster, String apiVersion,
            String kind, String namespace, String name);

    PaginatedResult list(RequestContext ctx, Identity identity, String cluster, String apiVersion, String kind,
            String namespace, ListOptions options);

    /**
     * Whether calls need a caller identity.
     */
    boolean requiresIdentity();
}
