package org.mcpkubernetes.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;

/**
 * Counters and timers for impersonation, permission checks, cluster reachability and tool calls.
 * Tags never carry user identity or cluster names, only low-cardinality categories.
 */
@ApplicationScoped
public class FederationMetrics {

    public static final String CLUSTER_LOCAL = "local";
    public static final String CLUSTER_REMOTE = "remote";

    private final MeterRegistry meterRegistry;

    @Inject
    public FederationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Metrics that go nowhere; for wiring without a registry.
     */
    public static FederationMetrics noop() {
        return new FederationMetrics(new CompositeMeterRegistry());
    }

    public static String clusterType(boolean local) {
        return local ? CLUSTER_LOCAL : CLUSTER_REMOTE;
    }

    /**
     * Record one impersonated client construction
     */
    public void recordImpersonation(String clusterType, boolean success) {
        Counter.builder("mcp.impersonation")
                .description("Impersonated client constructions")
                .tag("cluster_type", clusterType)
                .tag("result", success ? "success" : "error")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record one permission check; {@code result} is allowed, denied or error
     */
    public void recordAccessCheck(String clusterType, String result) {
        Counter.builder("mcp.access.checks")
                .description("Permission checks run against clusters")
                .tag("cluster_type", clusterType)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    public void recordConnectivityFailure(String reason) {
        Counter.builder("mcp.cluster.connectivity.failures")
                .description("Workload clusters found unreachable when building a client")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordToolInvocation(String tool, String status, String clusterType, Duration duration) {
        Timer.builder("mcp.tool.invocations")
                .description("Tool invocations by outcome")
                .tag("tool", tool)
                .tag("status", status)
                .tag("cluster_type", clusterType)
                .register(meterRegistry)
                .record(duration);
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }
}
