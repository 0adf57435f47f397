package org.mcpkubernetes.federation;

import org.mcpkubernetes.identity.UserHash;

/**
 * Clients are never shared across clusters or across principals.
 */
record CacheKey(String cluster, String principal) {

    @Override
    public String toString() {
        return ClusterNames.display(cluster) + "|" + UserHash.of(principal);
    }
}
