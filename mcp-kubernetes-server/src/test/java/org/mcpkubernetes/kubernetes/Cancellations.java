package org.mcpkubernetes.kubernetes;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.quarkiverse.mcp.server.Cancellation;
import java.util.Optional;
import org.mcpkubernetes.identity.RequestIdentityProvider;
import org.mcpkubernetes.metrics.FederationMetrics;

final class Cancellations {

    private Cancellations() {
    }

    static Cancellation none() {
        return withRequested(false);
    }

    static Cancellation requested() {
        return withRequested(true);
    }

    private static Cancellation withRequested(boolean requested) {
        Cancellation.Result result = new Cancellation.Result(requested, Optional.empty());
        Cancellation cancellation = mock(Cancellation.class);
        when(cancellation.check()).thenReturn(result);
        return cancellation;
    }

    static ToolAudit audit(RequestIdentityProvider identities) {
        return new ToolAudit(FederationMetrics.noop(), identities);
    }
}
