package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.Cancellation;
import io.quarkiverse.mcp.server.Tool;
import io.quarkiverse.mcp.server.ToolArg;
import io.quarkiverse.mcp.server.ToolCallException;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.mcpkubernetes.federation.ClusterNames;
import org.mcpkubernetes.federation.RequestContext;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.RequestIdentityProvider;
import org.mcpkubernetes.kubernetes.dto.ResourceGetOutput;
import org.mcpkubernetes.kubernetes.dto.ResourceListOutput;
import org.mcpkubernetes.kubernetes.operations.ClusterOperations;
import org.mcpkubernetes.output.Limits;
import org.mcpkubernetes.output.ListOptions;
import org.mcpkubernetes.output.OutputConfig;
import org.mcpkubernetes.output.PaginatedResult;
import org.mcpkubernetes.output.ProcessingResult;
import org.mcpkubernetes.output.ResourceSummarizer;
import org.mcpkubernetes.output.ResourceSummary;
import org.mcpkubernetes.output.ResponseProcessor;
import org.mcpkubernetes.output.SecretMasker;
import org.mcpkubernetes.output.SummaryOptions;

/**
 * Generic read tools for any resource type, on the local cluster or, in federation mode, on a workload cluster.
 */
@ApplicationScoped
public class ResourceTools {

    private static final Logger LOG = Logger.getLogger(ResourceTools.class);

    static final String FEDERATION_REQUIRED = "multi-cluster operations require federation mode to be enabled";
    static final String SENSITIVE_WARNING = "this resource may contain sensitive data; secret values are masked";

    private final FederationSupport federation;
    private final ClusterOperations operations;
    private final ResponseProcessor processor;
    private final RequestIdentityProvider identities;
    private final ToolAudit audit;

    @Inject
    public ResourceTools(FederationSupport federation, ClusterOperations operations, ResponseProcessor processor,
            RequestIdentityProvider identities, ToolAudit audit) {
        this.federation = federation;
        this.operations = operations;
        this.processor = processor;
        this.identities = identities;
        this.audit = audit;
    }

    @Tool(name = "kubernetes_list", description = "Lists resources of any kind. Large results are truncated; use "
            + "continueToken to page, or summary=true for counts.", structuredContent = true)
    @Blocking
    public ResourceListOutput list(
            @ToolArg(description = "API version, e.g. v1 or apps/v1.") String apiVersion,
            @ToolArg(description = "Resource kind, e.g. Pod or Deployment.") String kind,
            @ToolArg(description = "Namespace to list in.", defaultValue = "") String namespace,
            @ToolArg(description = "List across all namespaces.", defaultValue = "false") boolean allNamespaces,
            @ToolArg(description = "Label selector.", defaultValue = "") String labelSelector,
            @ToolArg(description = "Field selector.", defaultValue = "") String fieldSelector,
            @ToolArg(description = "Maximum items to return.", defaultValue = "0") int limit,
            @ToolArg(description = "Continue token from a previous page.", defaultValue = "") String continueToken,
            @ToolArg(description = "Return counts and a small sample instead of full objects.", defaultValue = "false") boolean summary,
            @ToolArg(description = "Workload cluster name; empty for the local cluster.", defaultValue = "") String cluster,
            Cancellation cancellation) {
        return audit.record("kubernetes_list", cluster, target(kind, namespace, ""), () -> doList(apiVersion, kind,
                namespace, allNamespaces, labelSelector, fieldSelector, limit, continueToken, summary, cluster,
                cancellation));
    }

    private ResourceListOutput doList(String apiVersion, String kind, String namespace, boolean allNamespaces,
            String labelSelector, String fieldSelector, int limit, String continueToken, boolean summary,
            String cluster, Cancellation cancellation) {
        requireArgument(apiVersion, "apiVersion");
        requireArgument(kind, "kind");
        String clusterName = requireReachable(cluster);
        Identity identity = callerIdentity();

        OutputConfig config = processor.config();
        int effectiveLimit = Limits.effectiveLimit(limit, config.maxItems(), OutputConfig.ABSOLUTE_MAX_ITEMS);
        ListOptions options = new ListOptions(labelSelector, fieldSelector, allNamespaces, effectiveLimit,
                continueToken);
        try {
            RequestContext ctx = federation.newRequest(cancellation);
            PaginatedResult page = operations.list(ctx, identity, clusterName, apiVersion, kind, namespace, options);
            if (summary || config.shouldSummarize(page.totalItems())) {
                ResourceSummary counts = ResourceSummarizer.summarize(page.items(), SummaryOptions.defaults());
                ProcessingResult sample = processor.process(counts.sample(), Math.max(1, counts.sample().size()));
                ResourceSummary resourceSummary = counts.withSample(sample.items(), sample.truncated());
                LOG.debugf("Summarized %d %s items on %s", page.items().size(), kind, ClusterNames.display(clusterName));
                return new ResourceListOutput(null, resourceSummary, page.continueToken(), page.resourceVersion(),
                        page.remainingItems(), page.totalItems(), sample.returnedCount(),
                        page.continueToken() != null, sample.warnings().isEmpty() ? null : sample.warnings(),
                        sample.metadata());
            }
            ProcessingResult processed = processor.process(page.items(), effectiveLimit);
            boolean truncated = processed.truncated() || page.continueToken() != null;
            return new ResourceListOutput(processed.items(), null, page.continueToken(), page.resourceVersion(),
                    page.remainingItems(), page.totalItems(), processed.returnedCount(), truncated,
                    processed.warnings().isEmpty() ? null : processed.warnings(), processed.metadata());
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("list " + kind, e, identity);
        }
    }

    @Tool(name = "kubernetes_get", description = "Gets a single resource. Secret values are masked.", structuredContent = true)
    @Blocking
    public ResourceGetOutput get(
            @ToolArg(description = "API version, e.g. v1 or apps/v1.") String apiVersion,
            @ToolArg(description = "Resource kind, e.g. Pod or Deployment.") String kind,
            @ToolArg(description = "Resource name.") String name,
            @ToolArg(description = "Namespace; empty for cluster-scoped resources.", defaultValue = "") String namespace,
            @ToolArg(description = "Workload cluster name; empty for the local cluster.", defaultValue = "") String cluster,
            Cancellation cancellation) {
        return audit.record("kubernetes_get", cluster, target(kind, namespace, name),
                () -> doGet(apiVersion, kind, name, namespace, cluster, cancellation));
    }

    private ResourceGetOutput doGet(String apiVersion, String kind, String name, String namespace, String cluster,
            Cancellation cancellation) {
        requireArgument(apiVersion, "apiVersion");
        requireArgument(kind, "kind");
        requireArgument(name, "name");
        String clusterName = requireReachable(cluster);
        Identity identity = callerIdentity();
        try {
            Map<String, Object> object = operations
                    .get(federation.newRequest(cancellation), identity, clusterName, apiVersion, kind, namespace, name)
                    .orElseThrow(() -> new ToolCallException("resource not found"));
            List<String> warnings = SecretMasker.containsSensitiveData(kind, name)
                    ? List.of(SENSITIVE_WARNING)
                    : List.of();
            return new ResourceGetOutput(ClusterNames.display(clusterName), processor.shape(object), warnings);
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("get " + kind, e, identity);
        }
    }

    private String requireReachable(String cluster) {
        String clusterName = ClusterNames.normalize(cluster);
        if (!ClusterNames.isLocal(clusterName) && !federation.enabled()) {
            throw new ToolCallException(FEDERATION_REQUIRED);
        }
        return clusterName;
    }

    private Identity callerIdentity() {
        if (!operations.requiresIdentity()) {
            return null;
        }
        try {
            return ToolIdentities.require(identities, "authentication required");
        } catch (RuntimeException e) {
            throw ToolErrors.toToolError("authenticate", e, null);
        }
    }

    static String target(String kind, String namespace, String name) {
        StringBuilder target = new StringBuilder(kind == null ? "" : kind);
        if (namespace != null && !namespace.isBlank()) {
            target.append(' ').append(namespace);
        }
        if (name != null && !name.isBlank()) {
            target.append(namespace == null || namespace.isBlank() ? " " : "/").append(name);
        }
        return target.toString();
    }

    private static void requireArgument(String value, String argument) {
        if (value == null || value.isBlank()) {
            throw new ToolCallException(argument + " parameter is required");
        }
    }
}
