package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.ToolCallException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;
import org.mcpkubernetes.federation.ClusterNames;
import org.mcpkubernetes.identity.RawIdentity;
import org.mcpkubernetes.identity.RequestIdentityProvider;
import org.mcpkubernetes.identity.UserHash;
import org.mcpkubernetes.metrics.FederationMetrics;

/**
 * One audit line and one timer sample per tool invocation. The caller appears only as a hash and an email domain.
 */
@ApplicationScoped
public class ToolAudit {

    static final String AUDIT_CATEGORY = "org.mcpkubernetes.audit";

    private static final Logger AUDIT = Logger.getLogger(AUDIT_CATEGORY);
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("\\p{Cntrl}");

    private final FederationMetrics metrics;
    private final RequestIdentityProvider identities;

    @Inject
    public ToolAudit(FederationMetrics metrics, RequestIdentityProvider identities) {
        this.metrics = metrics;
        this.identities = identities;
    }

    public <T> T record(String tool, String cluster, String target, Supplier<T> call) {
        long start = System.nanoTime();
        String clusterName = ClusterNames.normalize(cluster);
        String clusterType = FederationMetrics.clusterType(ClusterNames.isLocal(clusterName));
        try {
            T result = call.get();
            complete(tool, clusterName, clusterType, target, start, "success", null);
            return result;
        } catch (ToolCallException e) {
            complete(tool, clusterName, clusterType, target, start, "error", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            complete(tool, clusterName, clusterType, target, start, "error", e.getClass().getSimpleName());
            throw e;
        }
    }

    private void complete(String tool, String cluster, String clusterType, String target, long start, String status,
            String error) {
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordToolInvocation(tool, status, clusterType, duration);
        Optional<String> email = caller();
        String user = UserHash.of(email.orElse(null));
        String domain = email.map(ToolAudit::domain).map(ToolAudit::clean).orElse("");
        String safeTarget = clean(target);
        if (error == null) {
            AUDIT.infof("tool=%s user=%s domain=%s cluster=%s target=%s status=%s duration_ms=%d", tool, user, domain,
                    ClusterNames.display(cluster), safeTarget, status, duration.toMillis());
        } else {
            AUDIT.warnf("tool=%s user=%s domain=%s cluster=%s target=%s status=%s duration_ms=%d error=\"%s\"", tool,
                    user, domain, ClusterNames.display(cluster), safeTarget, status, duration.toMillis(), clean(error));
        }
    }

    private Optional<String> caller() {
        return identities.current().map(RawIdentity::email).filter(email -> !email.isBlank());
    }

    private static String clean(String value) {
        return value == null ? "" : CONTROL_CHARACTERS.matcher(value).replaceAll("");
    }

    static String domain(String email) {
        int at = email.lastIndexOf('@');
        return at < 0 || at == email.length() - 1 ? "" : email.substring(at + 1);
    }
}
