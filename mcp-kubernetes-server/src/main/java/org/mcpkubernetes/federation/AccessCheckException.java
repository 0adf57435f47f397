package org.mcpkubernetes.federation;

public class AccessCheckException extends FederationException {

    public AccessCheckException(String clusterName, Throwable cause) {
        super("SelfSubjectAccessReview failed on cluster '" + clusterName + "': " + cause.getMessage(), cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.EVALUATION;
    }

    @Override
    public String userFacingMessage() {
        return "unable to verify permissions - please try again or contact your administrator";
    }
}
