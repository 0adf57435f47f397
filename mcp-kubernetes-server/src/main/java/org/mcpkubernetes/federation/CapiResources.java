package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

public final class CapiResources {

    public static final String GROUP = "cluster.x-k8s.io";
    public static final String DEFAULT_VERSION = "v1beta2";
    public static final String KIND = "Cluster";
    public static final String PLURAL = "clusters";
    public static final String KUBECONFIG_SECRET_SUFFIX = "-kubeconfig";

    public static final ResourceDefinitionContext CLUSTER_CONTEXT = clusterContext(DEFAULT_VERSION);

    private CapiResources() {
    }

    public static ResourceDefinitionContext clusterContext(String version) {
        return new ResourceDefinitionContext.Builder()
                .withVersion(version)
                .withKind(KIND)
                .withGroup(GROUP)
                .withPlural(PLURAL)
                .withNamespaced(true)
                .build();
    }
}
