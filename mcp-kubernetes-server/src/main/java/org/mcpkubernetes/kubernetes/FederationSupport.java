package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.Cancellation;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.mcpkubernetes.federation.ClusterClientManager;
import org.mcpkubernetes.federation.RequestContext;

/**
 * The federation manager, when federation mode is enabled, plus the per-request timeout tools apply.
 */
public final class FederationSupport {

    private final Optional<ClusterClientManager> manager;
    private final Duration requestTimeout;

    public FederationSupport(Optional<ClusterClientManager> manager, Duration requestTimeout) {
        this.manager = manager;
        this.requestTimeout = requestTimeout;
    }

    public Optional<ClusterClientManager> manager() {
        return manager;
    }

    public boolean enabled() {
        return manager.isPresent();
    }

    /**
     * Request context bounded by the configured timeout and tied to the client's MCP cancellation notification.
     * {@code cancellation} may be null outside an MCP call.
     */
    public RequestContext newRequest(Cancellation cancellation) {
        if (cancellation == null) {
            return RequestContext.withTimeout(requestTimeout);
        }
        return RequestContext.withTimeout(Clock.systemUTC(), requestTimeout,
                () -> cancellation.check().isRequested());
    }
}
