package org.mcpkubernetes.federation;

public class ClusterDiscoveryException extends FederationException {

    private final boolean crdMissing;

    public ClusterDiscoveryException(String detail, boolean crdMissing, Throwable cause) {
        super("cluster discovery failed: " + detail, cause);
        this.crdMissing = crdMissing;
    }

    /**
     * True when the management cluster does not serve the Cluster API resource at all.
     */
    public boolean crdMissing() {
        return crdMissing;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.SERVICE_UNAVAILABLE;
    }

    @Override
    public String userFacingMessage() {
        return crdMissing
                ? "this management cluster does not have CAPI installed"
                : "unable to discover clusters - please try again or contact your administrator";
    }
}
