package org.mcpkubernetes.federation;

/**
 * Base type for failures raised while resolving clients or talking to clusters on behalf of a user.
 * <p>
 * {@link #getMessage()} may carry internal detail (hostnames, namespaces, API server text) and is meant for logs.
 * Only {@link #userFacingMessage()} may be shown to the caller.
 */
public abstract class FederationException extends RuntimeException {

    protected FederationException(String message) {
        super(message);
    }

    protected FederationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory category();

    public abstract String userFacingMessage();
}
