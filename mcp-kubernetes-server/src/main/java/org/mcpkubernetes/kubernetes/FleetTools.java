package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.Cancellation;
import io.quarkiverse.mcp.server.Tool;
import io.quarkiverse.mcp.server.ToolArg;
import io.quarkiverse.mcp.server.ToolCallException;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;
import org.mcpkubernetes.discovery.ClusterFilter;
import org.mcpkubernetes.discovery.ClusterListOptions;
import org.mcpkubernetes.discovery.ClusterSummary;
import org.mcpkubernetes.federation.ClusterClientManager;
import org.mcpkubernetes.federation.ClusterNames;
import org.mcpkubernetes.federation.RequestAbortedException;
import org.mcpkubernetes.federation.RequestContext;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.RequestIdentityProvider;
import org.mcpkubernetes.identity.UserHash;
import org.mcpkubernetes.kubernetes.dto.FleetClusterResult;
import org.mcpkubernetes.kubernetes.dto.FleetSummaryOutput;
import org.mcpkubernetes.kubernetes.operations.ClusterOperations;
import org.mcpkubernetes.output.Limits;
import org.mcpkubernetes.output.ListOptions;
import org.mcpkubernetes.output.OutputConfig;
import org.mcpkubernetes.output.PaginatedResult;
import org.mcpkubernetes.output.ResourceSummarizer;
import org.mcpkubernetes.output.ResourceSummary;
import org.mcpkubernetes.output.ResponseProcessor;
import org.mcpkubernetes.output.SummaryOptions;
import org.mcpkubernetes.output.TruncationWarning;

/**
 * Fleet-wide counts: one resource kind queried on many workload clusters, one cluster after another within a single
 * request deadline. The number of clusters per call is bounded by {@code mcp.kubernetes.output.max-clusters}.
 */
@ApplicationScoped
public class FleetTools {

    private static final Logger LOG = Logger.getLogger(FleetTools.class);

    static final String FEDERATION_REQUIRED = "fleet queries require federation mode to be enabled";

    private static final SummaryOptions STATUS_ONLY = new SummaryOptions(0, 0, true, false, false);

    private final FederationSupport federation;
    private final ClusterOperations operations;
    private final ResponseProcessor processor;
    private final RequestIdentityProvider identities;
    private final ToolAudit audit;

    @Inject
    public FleetTools(FederationSupport federation, ClusterOperations operations, ResponseProcessor processor,
            RequestIdentityProvider identities, ToolAudit audit) {
        this.federation = federation;
        this.operations = operations;
        this.processor = processor;
        this.identities = identities;
        this.audit = audit;
    }

    @Tool(name = "kubernetes_fleet_summary", description = "Counts resources of one kind across workload clusters, "
            + "with per-cluster status counts. Queries at most maxClusters clusters per call.", structuredContent = true)
    @Blocking
    public FleetSummaryOutput fleetSummary(
            @ToolArg(description = "API version, e.g. v1 or apps/v1.") String apiVersion,
            @ToolArg(description = "Resource kind, e.g. Pod or Deployment.") String kind,
            @ToolArg(description = "Namespace to count in; ignored when allNamespaces is true.", defaultValue = "") String namespace,
            @ToolArg(description = "Count across all namespaces.", defaultValue = "true") boolean allNamespaces,
            @ToolArg(description = "Label selector for the resources.", defaultValue = "") String labelSelector,
            @ToolArg(description = "Comma-separated cluster names; empty for every cluster you can see.", defaultValue = "") String clusters,
            @ToolArg(description = "Label selector for the clusters, used when clusters is empty.", defaultValue = "") String clusterLabelSelector,
            @ToolArg(description = "Maximum number of clusters to query (default and cap from server config).", defaultValue = "0") int maxClusters,
            Cancellation cancellation) {
        return audit.record("kubernetes_fleet_summary", "", ResourceTools.target(kind, namespace, ""),
                () -> summarize(apiVersion, kind, namespace, allNamespaces, labelSelector, clusters,
                        clusterLabelSelector, maxClusters, cancellation));
    }

    private FleetSummaryOutput summarize(String apiVersion, String kind, String namespace, boolean allNamespaces,
            String labelSelector, String clusters, String clusterLabelSelector, int maxClusters,
            Cancellation cancellation) {
        requireArgument(apiVersion, "apiVersion");
        requireArgument(kind, "kind");
        ClusterClientManager manager = federation.manager()
                .orElseThrow(() -> new ToolCallException(FEDERATION_REQUIRED));
        Identity identity = requireIdentity();
        OutputConfig config = processor.config();
        try {
            RequestContext ctx = federation.newRequest(cancellation);
            List<String> targets = targets(ctx, manager, identity, clusters, clusterLabelSelector);
            int clusterLimit = Limits.effectiveLimit(maxClusters, config.maxClusters(),
                    OutputConfig.ABSOLUTE_MAX_CLUSTERS);
            List<TruncationWarning> warnings = new ArrayList<>();
            List<String> queried = targets;
            if (targets.size() > clusterLimit) {
                queried = targets.subList(0, clusterLimit);
                warnings.add(TruncationWarning.forClusters(clusterLimit, targets.size()));
                LOG.debugf("Fleet query truncated to %d of %d clusters for %s", clusterLimit, targets.size(),
                        UserHash.of(identity));
            }

            ListOptions options = new ListOptions(labelSelector, "", allNamespaces, config.maxItems(), "");
            List<FleetClusterResult> results = new ArrayList<>(queried.size());
            Map<String, Integer> byStatus = new TreeMap<>();
            int total = 0;
            int failed = 0;
            for (String cluster : queried) {
                ctx.checkActive();
                try {
                    PaginatedResult page = operations.list(ctx, identity, cluster, apiVersion, kind, namespace,
                            options);
                    ResourceSummary counts = ResourceSummarizer.summarize(page.items(), STATUS_ONLY);
                    counts.byStatus().forEach((status, count) -> byStatus.merge(status, count, Integer::sum));
                    total += page.totalItems();
                    results.add(new FleetClusterResult(cluster, page.totalItems(), counts.byStatus(),
                            page.continueToken() != null ? Boolean.TRUE : null, null));
                } catch (RequestAbortedException e) {
                    throw e;
                } catch (RuntimeException e) {
                    failed++;
                    results.add(FleetClusterResult.failed(cluster,
                            ToolErrors.toToolError("list " + kind, e, identity).getMessage()));
                }
            }
            return new FleetSummaryOutput(kind, total, byStatus, results, queried.size(), failed, targets.size(),
                    !warnings.isEmpty(), warnings.isEmpty() ? null : warnings);
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("summarize " + kind + " across clusters", e, identity);
        }
    }

    private static List<String> targets(RequestContext ctx, ClusterClientManager manager, Identity identity,
            String clusters, String clusterLabelSelector) {
        if (clusters != null && !clusters.isBlank()) {
            List<String> named = Arrays.stream(clusters.split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .distinct()
                    .toList();
            named.forEach(ClusterNames::validate);
            return named;
        }
        ClusterListOptions filter = new ClusterListOptions(null, null, null, false, clusterLabelSelector);
        return ClusterFilter.filter(manager.listClusters(ctx, identity), filter).stream()
                .map(ClusterSummary::name)
                .toList();
    }

    private Identity requireIdentity() {
        try {
            return ToolIdentities.require(identities, "authentication required");
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("authenticate", e, null);
        }
    }

    private static void requireArgument(String value, String argument) {
        if (value == null || value.isBlank()) {
            throw new ToolCallException(argument + " parameter is required");
        }
    }
}
