package org.mcpkubernetes.federation;

public class KubeconfigException extends FederationException {

    public KubeconfigException(String clusterName, String detail) {
        super("invalid kubeconfig for cluster '" + clusterName + "': " + detail);
    }

    public KubeconfigException(String clusterName, String detail, Throwable cause) {
        super("invalid kubeconfig for cluster '" + clusterName + "': " + detail, cause);
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
