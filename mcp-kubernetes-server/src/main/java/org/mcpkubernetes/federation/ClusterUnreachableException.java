package org.mcpkubernetes.federation;

import java.util.Locale;

/**
 * A freshly built client could not reach its cluster's API server.
 */
public class ClusterUnreachableException extends ClusterConnectionException {

    public enum Reason {
        TIMEOUT("connection to cluster timed out - please verify the cluster is reachable from the management "
                + "cluster"),
        CERTIFICATE_EXPIRED("cluster certificate has expired - please contact your administrator to renew the "
                + "certificate"),
        CERTIFICATE_UNTRUSTED("cluster certificate not trusted - please verify the kubeconfig contains the correct "
                + "CA certificate"),
        HOSTNAME_MISMATCH("cluster certificate doesn't match the hostname - please contact your administrator"),
        TLS("secure connection to cluster failed - please contact your administrator"),
        UNREACHABLE("cluster access denied or unavailable");

        private final String userMessage;

        Reason(String userMessage) {
            this.userMessage = userMessage;
        }

        public boolean isTls() {
            return this == CERTIFICATE_EXPIRED || this == CERTIFICATE_UNTRUSTED || this == HOSTNAME_MISMATCH
                    || this == TLS;
        }

        public String tag() {
            return isTls() ? "tls" : name().toLowerCase(Locale.ROOT);
        }
    }

    private final Reason reason;

    public ClusterUnreachableException(String clusterName, Reason reason, Throwable cause) {
        super(clusterName, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String userFacingMessage() {
        return reason.userMessage;
    }
}
