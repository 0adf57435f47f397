package org.mcpkubernetes.federation;

/**
 * Buckets user-facing failures so the tool layer can pick a message template without inspecting exception text.
 */
public enum ErrorCategory {
    INPUT_VALIDATION,
    AUTHENTICATION,
    NOT_FOUND_OR_DENIED,
    SERVICE_UNAVAILABLE,
    EVALUATION,
    UNEXPECTED
}
