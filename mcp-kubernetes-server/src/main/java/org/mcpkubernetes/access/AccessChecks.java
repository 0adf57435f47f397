package org.mcpkubernetes.access;

import java.util.Set;

public final class AccessChecks {

    public static final Set<String> VALID_VERBS = Set.of("get", "list", "watch", "create", "update", "patch",
            "delete", "deletecollection", "impersonate", "bind", "escalate", "*");

    private AccessChecks() {
    }

    public static void validate(AccessCheck check) {
        if (check == null) {
            throw new InvalidAccessCheckException("access check is required");
        }
        if (isBlank(check.verb())) {
            throw new InvalidAccessCheckException("verb is required");
        }
        if (isBlank(check.resource())) {
            throw new InvalidAccessCheckException("resource is required");
        }
        if (!VALID_VERBS.contains(check.verb())) {
            throw new InvalidAccessCheckException("invalid verb '" + check.verb() + "'");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
