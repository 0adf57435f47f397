package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Locates a workload cluster's admin kubeconfig through the CAPI convention: a secret named
 * {@code <cluster>-kubeconfig} in the cluster's namespace on the management cluster.
 * <p>
 * The lookup runs with the caller's impersonated management-cluster client, so a user who cannot read the secret
 * cannot reach the cluster.
 */
public class KubeconfigResolver {

    private static final Logger LOG = Logger.getLogger(KubeconfigResolver.class);

    static final String PRIMARY_KEY = "value";
    static final String FALLBACK_KEY = "kubeconfig";

    private final CapiClusterSource clusters;

    public KubeconfigResolver(CapiClusterSource clusters) {
        this.clusters = clusters;
    }

    public Config resolve(RequestContext ctx, KubernetesClient managementClient, String clusterName) {
        ctx.checkActive();
        GenericKubernetesResource cluster;
        try {
            cluster = clusters.findByName(managementClient, clusterName)
                    .orElseThrow(() -> new ClusterNotFoundException(clusterName,
                            "no CAPI Cluster resource found with this name"));
        } catch (ClusterDiscoveryException e) {
            throw new ClusterNotFoundException(clusterName, "failed to query CAPI clusters", e);
        }
        String namespace = cluster.getMetadata().getNamespace();
        String secretName = clusterName + CapiResources.KUBECONFIG_SECRET_SUFFIX;

        ctx.checkActive();
        Secret secret;
        try {
            secret = managementClient.secrets().inNamespace(namespace).withName(secretName).get();
        } catch (KubernetesClientException e) {
            LOG.debugf("Failed to read secret %s/%s: %s", namespace, secretName, e.getMessage());
            throw new KubeconfigException(clusterName, "failed to fetch secret " + namespace + "/" + secretName, e);
        }
        if (secret == null) {
            throw new ClusterNotFoundException(clusterName, "kubeconfig secret " + namespace + "/" + secretName
                    + " not found");
        }
        return parse(clusterName, extract(clusterName, secret));
    }

    private static String extract(String clusterName, Secret secret) {
        Map<String, String> data = secret.getData() == null ? Map.of() : secret.getData();
        String encoded = data.get(PRIMARY_KEY);
        if (encoded == null || encoded.isEmpty()) {
            encoded = data.get(FALLBACK_KEY);
        }
        if (encoded == null || encoded.isEmpty()) {
            throw new KubeconfigException(clusterName, "secret has neither '" + PRIMARY_KEY + "' nor '"
                    + FALLBACK_KEY + "' key");
        }
        try {
            return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new KubeconfigException(clusterName, "secret data is not valid base64", e);
        }
    }

    private static Config parse(String clusterName, String kubeconfig) {
        Config config;
        try {
            config = Config.fromKubeconfig(kubeconfig);
        } catch (RuntimeException e) {
            throw new KubeconfigException(clusterName, "unable to parse kubeconfig", e);
        }
        if (config.getMasterUrl() == null || config.getMasterUrl().isBlank()) {
            throw new KubeconfigException(clusterName, "kubeconfig has no server URL");
        }
        return config;
    }
}
