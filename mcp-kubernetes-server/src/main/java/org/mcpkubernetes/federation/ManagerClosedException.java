package org.mcpkubernetes.federation;

public class ManagerClosedException extends FederationException {

    public ManagerClosedException() {
        super("cluster client manager has been closed");
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.SERVICE_UNAVAILABLE;
    }

    @Override
    public String userFacingMessage() {
        return "service temporarily unavailable";
    }
}
