package org.mcpkubernetes.discovery;

import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.federation.FederationException;

public class InvalidSelectorException extends FederationException {

    public InvalidSelectorException(String selector, String detail) {
        super("invalid label selector '" + selector + "': " + detail);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INPUT_VALIDATION;
    }

    @Override
    public String userFacingMessage() {
        return "invalid label selector provided";
    }
}
