package org.mcpkubernetes.access;

import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.federation.FederationException;

/**
 * The request is malformed. The message names the offending field and is safe to show.
 */
public class InvalidAccessCheckException extends FederationException {

    public InvalidAccessCheckException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INPUT_VALIDATION;
    }

    @Override
    public String userFacingMessage() {
        return getMessage();
    }
}
