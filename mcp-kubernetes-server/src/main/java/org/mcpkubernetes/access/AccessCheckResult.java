package org.mcpkubernetes.access;

/**
 * Outcome of a permission check.
 *
 * @param allowed         the API server allowed the action
 * @param denied          the API server explicitly denied the action
 * @param reason          explanation from the authorizer, safe to display
 * @param evaluationError raw evaluation failure text; pass it through {@link EvaluationErrorSanitizer} before display
 */
public record AccessCheckResult(boolean allowed, boolean denied, String reason, String evaluationError) {
}
