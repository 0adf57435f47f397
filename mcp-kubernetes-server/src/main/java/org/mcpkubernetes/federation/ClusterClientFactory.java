package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.mcpkubernetes.identity.Identity;

/**
 * Builds clients that act as a given user. Implementations never cache; {@link ClientCache} does.
 */
public interface ClusterClientFactory {

    KubernetesClient localClient(Identity identity);

    KubernetesClient remoteClient(String clusterName, Config clusterConfig, Identity identity);
}
