package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.mcpkubernetes.identity.Identity;

public class ImpersonatingClientFactory implements ClusterClientFactory {

    public static final String DEFAULT_AGENT_NAME = "mcp-kubernetes";

    private final Config localConfig;
    private final String agentName;
    private final ConnectivityConfig connectivity;

    public ImpersonatingClientFactory(Config localConfig, String agentName, ConnectivityConfig connectivity) {
        this.localConfig = localConfig;
        this.agentName = agentName;
        this.connectivity = connectivity;
    }

    @Override
    public KubernetesClient localClient(Identity identity) {
        return build(ClusterNames.LOCAL, configure(localConfig, identity));
    }

    @Override
    public KubernetesClient remoteClient(String clusterName, Config clusterConfig, Identity identity) {
        return build(clusterName, configure(clusterConfig, identity));
    }

    /**
     * Impersonated copy of {@code base} with the configured connect and request timeouts, so a hung API server
     * fails the call instead of holding the tool invocation open.
     */
    Config configure(Config base, Identity identity) {
        return new ConfigBuilder(Impersonation.apply(base, identity, agentName))
                .withConnectionTimeout(ConnectivityConfig.millis(connectivity.connectionTimeout()))
                .withRequestTimeout(ConnectivityConfig.millis(connectivity.requestTimeout()))
                .build();
    }

    private static KubernetesClient build(String clusterName, Config config) {
        try {
            return new KubernetesClientBuilder().withConfig(config).build();
        } catch (KubernetesClientException e) {
            throw new ClusterConnectionException(ClusterNames.display(clusterName), e);
        }
    }
}
