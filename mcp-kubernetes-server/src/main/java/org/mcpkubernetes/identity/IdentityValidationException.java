package org.mcpkubernetes.identity;

import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.federation.FederationException;

public class IdentityValidationException extends FederationException {

    public enum Reason {
        USER_INFO_REQUIRED("user info"),
        MISSING_EMAIL("email"),
        INVALID_EMAIL("email"),
        INVALID_GROUP_NAME("group name"),
        INVALID_EXTRA("extra header");

        private final String field;

        Reason(String field) {
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    private final Reason reason;

    public IdentityValidationException(Reason reason, String value, String detail) {
        super(reason.field() + " validation failed for '" + truncate(value) + "': " + detail);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public ErrorCategory category() {
        return switch (reason) {
            case USER_INFO_REQUIRED, MISSING_EMAIL -> ErrorCategory.AUTHENTICATION;
            default -> ErrorCategory.INPUT_VALIDATION;
        };
    }

    @Override
    public String userFacingMessage() {
        if (category() == ErrorCategory.AUTHENTICATION) {
            return "authentication required";
        }
        return "invalid " + reason.field() + " provided";
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > 20 ? value.substring(0, 20) + "..." : value;
    }
}
