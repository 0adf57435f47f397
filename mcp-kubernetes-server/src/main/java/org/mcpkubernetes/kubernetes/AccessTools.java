package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.Cancellation;
import io.quarkiverse.mcp.server.Tool;
import io.quarkiverse.mcp.server.ToolArg;
import io.quarkiverse.mcp.server.ToolCallException;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.mcpkubernetes.access.AccessCheck;
import org.mcpkubernetes.access.AccessCheckResult;
import org.mcpkubernetes.access.EvaluationErrorSanitizer;
import org.mcpkubernetes.federation.ClusterClientManager;
import org.mcpkubernetes.federation.ClusterNames;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.RequestIdentityProvider;
import org.mcpkubernetes.kubernetes.dto.AccessCheckInfo;
import org.mcpkubernetes.kubernetes.dto.CanIResponse;

@ApplicationScoped
public class AccessTools {

    static final String NO_USER = "authentication required: no user info in context";
    static final String FEDERATION_REQUIRED = "permission checks require federation mode to be enabled";

    private final FederationSupport federation;
    private final RequestIdentityProvider identities;
    private final ToolAudit audit;

    @Inject
    public AccessTools(FederationSupport federation, RequestIdentityProvider identities, ToolAudit audit) {
        this.federation = federation;
        this.identities = identities;
        this.audit = audit;
    }

    @Tool(name = "can_i", description = "Checks whether the current user may perform an action on a Kubernetes "
            + "resource, evaluated by the target cluster's own authorizer.", structuredContent = true)
    @Blocking
    public CanIResponse canI(
            @ToolArg(description = "Verb to check (get, list, watch, create, update, patch, delete, ...).", defaultValue = "") String verb,
            @ToolArg(description = "Resource type, plural (e.g. pods, deployments).", defaultValue = "") String resource,
            @ToolArg(description = "API group; empty for the core group.", defaultValue = "") String apiGroup,
            @ToolArg(description = "Namespace; empty for cluster-scoped checks.", defaultValue = "") String namespace,
            @ToolArg(description = "Specific resource name.", defaultValue = "") String name,
            @ToolArg(description = "Subresource (e.g. logs, exec, scale).", defaultValue = "") String subresource,
            @ToolArg(description = "Target cluster; empty for the management cluster.", defaultValue = "") String cluster,
            Cancellation cancellation) {
        return audit.record("can_i", cluster, (verb == null ? "" : verb) + " " + (resource == null ? "" : resource),
                () -> check(verb, resource, apiGroup, namespace, name, subresource, cluster, cancellation));
    }

    private CanIResponse check(String verb, String resource, String apiGroup, String namespace, String name,
            String subresource, String cluster, Cancellation cancellation) {
        if (verb == null || verb.isBlank()) {
            throw new ToolCallException("verb is required");
        }
        if (resource == null || resource.isBlank()) {
            throw new ToolCallException("resource is required");
        }
        ClusterClientManager manager = federation.manager()
                .orElseThrow(() -> new ToolCallException(FEDERATION_REQUIRED));
        Identity identity = null;
        try {
            identity = ToolIdentities.require(identities, NO_USER);
            AccessCheck check = new AccessCheck(verb.trim(), resource.trim(), trim(apiGroup), trim(namespace),
                    trim(name), trim(subresource));
            String clusterName = ClusterNames.normalize(cluster);
            AccessCheckResult result = manager.checkAccess(federation.newRequest(cancellation), clusterName, identity, check);

            String reason = EvaluationErrorSanitizer.displayReason(result);
            return new CanIResponse(
                    result.allowed(),
                    result.denied() ? Boolean.TRUE : null,
                    reason.isEmpty() ? null : reason,
                    identity.email(),
                    ClusterNames.display(clusterName),
                    new AccessCheckInfo(check.verb(), check.resource(), check.apiGroup(), check.namespace(),
                            check.name(), check.subresource()));
        } catch (RuntimeException e) {
            throw ToolErrors.toAccessToolError(e, identity);
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
