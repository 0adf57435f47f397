package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.List;
import org.mcpkubernetes.access.AccessCheck;
import org.mcpkubernetes.access.AccessCheckResult;
import org.mcpkubernetes.discovery.ClusterSummary;
import org.mcpkubernetes.identity.Identity;

/**
 * Hands out clients that impersonate a user on a given cluster. An empty cluster name means the management
 * cluster this server runs against.
 */
public interface ClusterClientManager extends AutoCloseable {

    KubernetesClient resolve(RequestContext ctx, String clusterName, Identity identity);

    List<ClusterSummary> listClusters(RequestContext ctx, Identity identity);

    ClusterSummary getClusterSummary(RequestContext ctx, String clusterName, Identity identity);

    AccessCheckResult checkAccess(RequestContext ctx, String clusterName, Identity identity, AccessCheck check);

    CacheStats stats();

    int invalidate(String clusterName);

    int evictExpired();

    @Override
    void close();
}
