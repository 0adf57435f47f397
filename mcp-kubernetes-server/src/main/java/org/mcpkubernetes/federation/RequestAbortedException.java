package org.mcpkubernetes.federation;

public class RequestAbortedException extends FederationException {

    public RequestAbortedException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.SERVICE_UNAVAILABLE;
    }

    @Override
    public String userFacingMessage() {
        return "request cancelled or timed out";
    }
}
