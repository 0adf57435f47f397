package org.mcpkubernetes.federation;

/**
 * Building or reaching a client failed for a reason that may go away (network, expired upstream credentials).
 * It is reported once and never retried here.
 */
public class ClusterConnectionException extends FederationException {

    public ClusterConnectionException(String clusterName, Throwable cause) {
        super("unable to connect to cluster '" + clusterName + "': " + cause.getMessage(), cause);
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
