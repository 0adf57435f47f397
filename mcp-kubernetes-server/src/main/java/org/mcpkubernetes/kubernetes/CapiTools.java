package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.Cancellation;
import io.quarkiverse.mcp.server.Tool;
import io.quarkiverse.mcp.server.ToolArg;
import io.quarkiverse.mcp.server.ToolCallException;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;
import org.mcpkubernetes.discovery.ClusterFilter;
import org.mcpkubernetes.discovery.ClusterHealthEvaluator;
import org.mcpkubernetes.discovery.ClusterListOptions;
import org.mcpkubernetes.discovery.ClusterPatternResolver;
import org.mcpkubernetes.discovery.ClusterSummary;
import org.mcpkubernetes.discovery.HealthReport;
import org.mcpkubernetes.discovery.PatternResolution;
import org.mcpkubernetes.federation.ClusterClientManager;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.RequestIdentityProvider;
import org.mcpkubernetes.identity.UserHash;
import org.mcpkubernetes.kubernetes.dto.ClusterDetailOutput;
import org.mcpkubernetes.kubernetes.dto.ClusterListItem;
import org.mcpkubernetes.kubernetes.dto.ClusterListOutput;
import org.mcpkubernetes.kubernetes.dto.ClusterResolveOutput;
import org.mcpkubernetes.output.Limits;

/**
 * Cluster API discovery tools. Every call lists clusters on the management cluster as the calling user.
 */
@ApplicationScoped
public class CapiTools {

    private static final Logger LOG = Logger.getLogger(CapiTools.class);

    static final int DEFAULT_MAX_RESULTS = 100;
    static final int MAX_RESULTS_LIMIT = 500;

    private final FederationSupport federation;
    private final RequestIdentityProvider identities;
    private final ToolAudit audit;
    private final Clock clock;

    @Inject
    public CapiTools(FederationSupport federation, RequestIdentityProvider identities, ToolAudit audit) {
        this(federation, identities, audit, Clock.systemUTC());
    }

    CapiTools(FederationSupport federation, RequestIdentityProvider identities, ToolAudit audit, Clock clock) {
        this.federation = federation;
        this.identities = identities;
        this.audit = audit;
        this.clock = clock;
    }

    @Tool(name = "capi_list_clusters", description = "Lists workload clusters known to the management cluster, "
            + "with optional filters.", structuredContent = true)
    @Blocking
    public ClusterListOutput listClusters(
            @ToolArg(description = "Organization namespace to filter by.", defaultValue = "") String organization,
            @ToolArg(description = "Infrastructure provider (aws, azure, vsphere, gcp, ...).", defaultValue = "") String provider,
            @ToolArg(description = "Cluster phase (Provisioned, Provisioning, Deleting, Failed, ...).", defaultValue = "") String status,
            @ToolArg(description = "Only return clusters that are fully ready.", defaultValue = "false") boolean readyOnly,
            @ToolArg(description = "Kubernetes label selector (e.g. env=prod,team!=qa).", defaultValue = "") String labelSelector,
            @ToolArg(description = "Maximum number of clusters to return (default 100, max 500).", defaultValue = "0") int limit,
            Cancellation cancellation) {
        return audit.record("capi_list_clusters", "", "clusters",
                () -> doListClusters(organization, provider, status, readyOnly, labelSelector, limit, cancellation));
    }

    private ClusterListOutput doListClusters(String organization, String provider, String status, boolean readyOnly,
            String labelSelector, int limit, Cancellation cancellation) {
        ClusterClientManager manager = requireManager();
        Identity identity = requireIdentity();
        try {
            List<ClusterSummary> clusters = manager.listClusters(federation.newRequest(cancellation), identity);
            ClusterListOptions options = new ClusterListOptions(organization, provider, status, readyOnly,
                    labelSelector);
            List<ClusterSummary> filtered = ClusterFilter.filter(clusters, options);

            int effectiveLimit = Limits.clamp(limit, DEFAULT_MAX_RESULTS, MAX_RESULTS_LIMIT);
            Instant now = clock.instant();
            List<ClusterListItem> items = filtered.stream()
                    .limit(effectiveLimit)
                    .map(cluster -> ClusterViews.toListItem(cluster, now))
                    .toList();
            boolean truncated = filtered.size() > items.size();
            if (truncated) {
                LOG.debugf("Cluster list truncated to %d of %d for %s", items.size(), filtered.size(),
                        UserHash.of(identity));
            }
            return new ClusterListOutput(items, filtered.size(), items.size(), truncated, options.isFiltered());
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("list clusters", e, identity);
        }
    }

    @Tool(name = "capi_get_cluster", description = "Returns details of a single workload cluster.", structuredContent = true)
    @Blocking
    public ClusterDetailOutput getCluster(
            @ToolArg(description = "Exact cluster name.", defaultValue = "") String name,
            Cancellation cancellation) {
        return audit.record("capi_get_cluster", "", "cluster " + name, () -> doGetCluster(name, cancellation));
    }

    private ClusterDetailOutput doGetCluster(String name, Cancellation cancellation) {
        String clusterName = requireArgument(name, "name");
        ClusterClientManager manager = requireManager();
        Identity identity = requireIdentity();
        try {
            ClusterSummary cluster = manager.getClusterSummary(federation.newRequest(cancellation), clusterName,
                    identity);
            return ClusterViews.toDetail(cluster, clock.instant());
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("get cluster", e, identity);
        }
    }

    @Tool(name = "capi_resolve_cluster", description = "Resolves a partial cluster name to a single cluster. "
            + "An exact name match always wins.", structuredContent = true)
    @Blocking
    public ClusterResolveOutput resolveCluster(
            @ToolArg(description = "Cluster name or case-insensitive fragment of it.", defaultValue = "") String pattern,
            Cancellation cancellation) {
        return audit.record("capi_resolve_cluster", "", "pattern " + pattern,
                () -> doResolveCluster(pattern, cancellation));
    }

    private ClusterResolveOutput doResolveCluster(String pattern, Cancellation cancellation) {
        String needle = requireArgument(pattern, "pattern");
        ClusterClientManager manager = requireManager();
        Identity identity = requireIdentity();
        try {
            List<ClusterSummary> clusters = manager.listClusters(federation.newRequest(cancellation), identity);
            PatternResolution resolution = ClusterPatternResolver.resolve(clusters, needle);
            Instant now = clock.instant();
            if (resolution.resolved()) {
                ClusterSummary cluster = resolution.cluster();
                return new ClusterResolveOutput(true, ClusterViews.toListItem(cluster, now), null,
                        String.format("Pattern '%s' resolved to cluster '%s' in namespace '%s'.", needle,
                                cluster.name(), cluster.namespace()));
            }
            if (resolution.matches().isEmpty()) {
                return new ClusterResolveOutput(false, null, null, String.format(
                        "No clusters match pattern '%s'. Use capi_list_clusters to see available clusters.", needle));
            }
            List<ClusterListItem> matches = resolution.matches().stream()
                    .map(cluster -> ClusterViews.toListItem(cluster, now))
                    .toList();
            return new ClusterResolveOutput(false, null, matches, String.format(
                    "Multiple clusters match pattern '%s'. Please use a more specific name.", needle));
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("resolve cluster", e, identity);
        }
    }

    @Tool(name = "capi_cluster_health", description = "Reports the health of a workload cluster from its Cluster "
            + "API status.", structuredContent = true)
    @Blocking
    public HealthReport clusterHealth(
            @ToolArg(description = "Exact cluster name.", defaultValue = "") String name,
            Cancellation cancellation) {
        return audit.record("capi_cluster_health", "", "cluster " + name,
                () -> doClusterHealth(name, cancellation));
    }

    private HealthReport doClusterHealth(String name, Cancellation cancellation) {
        String clusterName = requireArgument(name, "name");
        ClusterClientManager manager = requireManager();
        Identity identity = requireIdentity();
        try {
            ClusterSummary cluster = manager.getClusterSummary(federation.newRequest(cancellation), clusterName,
                    identity);
            return ClusterHealthEvaluator.evaluate(cluster);
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("get cluster health", e, identity);
        }
    }

    private ClusterClientManager requireManager() {
        return federation.manager().orElseThrow(() -> new ToolCallException("this operation is not available"));
    }

    private Identity requireIdentity() {
        try {
            return ToolIdentities.require(identities, "authentication required");
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("authenticate", e, null);
        }
    }

    private static String requireArgument(String value, String argument) {
        if (value == null || value.isBlank()) {
            throw new ToolCallException(argument + " parameter is required");
        }
        return value.trim();
    }
}
