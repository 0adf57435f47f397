package org.mcpkubernetes.federation;

public class InvalidClusterNameException extends FederationException {

    public InvalidClusterNameException(String reason) {
        super("invalid cluster name: " + reason);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INPUT_VALIDATION;
    }

    @Override
    public String userFacingMessage() {
        return "invalid cluster name provided";
    }
}
