package org.mcpkubernetes.federation;

/**
 * The cluster does not exist or the caller cannot see it. Both cases share one message so existence does not leak.
 */
public class ClusterNotFoundException extends FederationException {

    private final String clusterName;

    public ClusterNotFoundException(String clusterName, String detail) {
        super("cluster '" + clusterName + "' not found: " + detail);
        this.clusterName = clusterName;
    }

    public ClusterNotFoundException(String clusterName, String detail, Throwable cause) {
        super("cluster '" + clusterName + "' not found: " + detail, cause);
        this.clusterName = clusterName;
    }

    public String clusterName() {
        return clusterName;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NOT_FOUND_OR_DENIED;
    }

    @Override
    public String userFacingMessage() {
        return "cluster access denied or unavailable";
    }
}
