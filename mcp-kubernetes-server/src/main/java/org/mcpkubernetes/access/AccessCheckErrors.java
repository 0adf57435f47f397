package org.mcpkubernetes.access;

import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.federation.FederationException;

public final class AccessCheckErrors {

    private AccessCheckErrors() {
    }

    /**
     * True when the request itself is malformed. Retrying without changing the input will not help, and the
     * message describes the caller's own input, so it may be shown as is.
     */
    public static boolean isValidationError(Throwable error) {
        return error instanceof FederationException federation
                && federation.category() == ErrorCategory.INPUT_VALIDATION;
    }
}
