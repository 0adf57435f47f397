package org.mcpkubernetes.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "mcp.kubernetes")
public interface McpKubernetesConfig {

    Federation federation();

    Cache cache();

    Output output();

    interface Federation {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("30s")
        Duration requestTimeout();

        /**
         * Served version of {@code clusters.cluster.x-k8s.io} on the management cluster.
         */
        @WithDefault("v1beta2")
        String capiVersion();

        /**
         * Value of the {@code agent} impersonation extra attached to every impersonated request.
         */
        @WithDefault("mcp-kubernetes")
        String agentName();

        /**
         * JSON object renaming identity provider groups to cluster RBAC groups, e.g.
         * {@code {"okta-admins":"cluster-admins"}}.
         */
        Optional<String> groupMappings();

        Connectivity connectivity();
    }

    interface Connectivity {

        @WithDefault("5s")
        Duration connectionTimeout();

        /**
         * Timeout set on every impersonated client; each API call fails after it.
         */
        @WithDefault("30s")
        Duration requestTimeout();

        @WithDefault("3")
        int retryAttempts();

        @WithDefault("1s")
        Duration retryBackoff();

        /**
         * Check that a workload cluster answers before its client is cached.
         */
        @WithDefault("true")
        boolean checkEnabled();
    }

    interface Cache {

        @WithDefault("10m")
        Duration ttl();

        @WithDefault("1000")
        int maxEntries();

        @WithDefault("1m")
        Duration cleanupInterval();
    }

    interface Output {

        @WithDefault("100")
        int maxItems();

        @WithDefault("20")
        int maxClusters();

        @WithDefault("524288")
        long maxResponseBytes();

        @WithDefault("true")
        boolean slimOutput();

        @WithDefault("true")
        boolean maskSecrets();

        @WithDefault("500")
        int summaryThreshold();

        Optional<List<String>> excludedFields();
    }
}
