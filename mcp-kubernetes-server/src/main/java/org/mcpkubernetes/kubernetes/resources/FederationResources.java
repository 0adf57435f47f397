package org.mcpkubernetes.kubernetes.resources;

import io.quarkiverse.mcp.server.Resource;
import io.quarkiverse.mcp.server.TextResourceContents;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.mcpkubernetes.federation.CacheStats;
import org.mcpkubernetes.kubernetes.FederationSupport;
import org.mcpkubernetes.output.OutputConfig;

@ApplicationScoped
public class FederationResources {

    static final String STATUS_URI = "kubernetes://federation/status";

    private final FederationSupport federation;
    private final OutputConfig outputConfig;

    @Inject
    public FederationResources(FederationSupport federation, OutputConfig outputConfig) {
        this.federation = federation;
        this.outputConfig = outputConfig;
    }

    @Resource(uri = STATUS_URI, description = "Federation mode, client cache statistics and output limits")
    @Blocking
    public TextResourceContents federationStatus() {
        StringBuilder body = new StringBuilder()
                .append("Federation mode: ").append(federation.enabled() ? "enabled" : "disabled").append('\n');
        federation.manager().ifPresent(manager -> {
            CacheStats stats = manager.stats();
            body.append("Client cache: ").append(stats.cacheSize()).append('/').append(stats.maxEntries())
                    .append(" entries, ttl ").append(stats.ttl())
                    .append(", hits ").append(stats.hits())
                    .append(", misses ").append(stats.misses())
                    .append(", evictions ").append(stats.evictions())
                    .append(stats.closed() ? ", closed" : "").append('\n');
        });
        body.append("Max items per response: ").append(outputConfig.maxItems()).append('\n')
                .append("Max clusters per fan-out: ").append(outputConfig.maxClusters()).append('\n')
                .append("Max response bytes: ").append(outputConfig.maxResponseBytes()).append('\n')
                .append("Summary threshold: ").append(outputConfig.summaryThreshold()).append('\n')
                .append("Slim output: ").append(outputConfig.slimOutput()).append('\n')
                .append("Mask secrets: ").append(outputConfig.maskSecrets());
        return TextResourceContents.create(STATUS_URI, body.toString());
    }
}
