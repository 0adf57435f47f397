package org.mcpkubernetes.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.quarkiverse.mcp.server.ToolCallException;
import org.jboss.logging.Logger;
import org.mcpkubernetes.access.AccessCheckErrors;
import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.federation.FederationException;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.UserHash;

/**
 * Maps internal failures to the fixed messages callers are allowed to see. Detail only goes to the log.
 */
final class ToolErrors {

    private static final Logger LOG = Logger.getLogger(ToolErrors.class);

    private ToolErrors() {
    }

    static ToolCallException unexpected(String operation) {
        return new ToolCallException("failed to " + operation + ": an unexpected error occurred");
    }

    /**
     * Translation used by cluster discovery and resource tools.
     */
    static ToolCallException toToolError(String operation, RuntimeException error, Identity identity) {
        if (error instanceof ToolCallException toolError) {
            return toolError;
        }
        String user = UserHash.of(identity);
        if (error instanceof FederationException federation) {
            if (federation.category() == ErrorCategory.INPUT_VALIDATION) {
                LOG.debugf("%s rejected for %s: %s", operation, user, federation.getMessage());
            } else {
                LOG.warnf("%s failed for %s: %s", operation, user, federation.getMessage());
            }
            if (federation.category() == ErrorCategory.UNEXPECTED) {
                return unexpected(operation);
            }
            return new ToolCallException(federation.userFacingMessage());
        }
        if (error instanceof KubernetesClientException client) {
            LOG.warnf("%s failed for %s with HTTP %d: %s", operation, user, client.getCode(), client.getMessage());
            if (client.getCode() == 401 || client.getCode() == 403) {
                return new ToolCallException("access denied: insufficient permissions to " + operation);
            }
            if (client.getCode() == 404) {
                return new ToolCallException("resource not found");
            }
            return unexpected(operation);
        }
        LOG.errorf(error, "%s failed unexpectedly for %s", operation, user);
        return unexpected(operation);
    }

    /**
     * Permission checks show validation problems and hide everything else behind one message.
     */
    static ToolCallException toAccessToolError(RuntimeException error, Identity identity) {
        if (error instanceof ToolCallException toolError) {
            return toolError;
        }
        if (AccessCheckErrors.isValidationError(error)) {
            LOG.debugf("Access check rejected for %s: %s", UserHash.of(identity), error.getMessage());
            return new ToolCallException("invalid request: " + ((FederationException) error).userFacingMessage());
        }
        if (error instanceof FederationException federation) {
            LOG.warnf("Access check failed for %s: %s", UserHash.of(identity), federation.getMessage());
        } else {
            LOG.errorf(error, "Access check failed unexpectedly for %s", UserHash.of(identity));
        }
        return new ToolCallException("failed to check permissions - please try again");
    }
}
