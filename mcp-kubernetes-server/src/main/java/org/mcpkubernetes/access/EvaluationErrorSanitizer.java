package org.mcpkubernetes.access;

import java.util.List;
import java.util.Locale;

/**
 * Turns raw authorizer evaluation errors into one of a few fixed messages.
 * <p>
 * Evaluation errors can contain API server hostnames, webhook endpoints and internal group names. Nothing from
 * the raw text is ever echoed; unrecognized input maps to a generic message.
 */
public final class EvaluationErrorSanitizer {

    public static final String RESOURCE_NOT_RECOGNIZED = "resource type not recognized";
    public static final String POLICY_EVALUATION_FAILED = "policy evaluation failed";
    public static final String TIMED_OUT = "permission check timed out";
    public static final String INTERNAL_ERROR = "internal evaluation error";
    public static final String GENERIC = "unable to evaluate permissions";

    private record Rule(List<String> keywords, String message) {

        boolean matches(String lowered) {
            return keywords.stream().anyMatch(lowered::contains);
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule(List.of("unable to find", "not found", "no matches for kind"), RESOURCE_NOT_RECOGNIZED),
            new Rule(List.of("webhook", "admission controller"), POLICY_EVALUATION_FAILED),
            new Rule(List.of("timeout", "deadline exceeded"), TIMED_OUT),
            new Rule(List.of("internal error", "server error"), INTERNAL_ERROR));

    private EvaluationErrorSanitizer() {
    }

    public static String sanitize(String rawEvaluationError) {
        if (rawEvaluationError == null || rawEvaluationError.isEmpty()) {
            return "";
        }
        String lowered = rawEvaluationError.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.matches(lowered))
                .map(Rule::message)
                .findFirst()
                .orElse(GENERIC);
    }

    /**
     * Reason to show for a check result: the authorizer reason plus the sanitized evaluation error, if any.
     */
    public static String displayReason(AccessCheckResult result) {
        String reason = result.reason() == null ? "" : result.reason();
        String evaluation = sanitize(result.evaluationError());
        if (evaluation.isEmpty()) {
            return reason;
        }
        if (reason.isEmpty()) {
            return "evaluation error: " + evaluation;
        }
        return reason + " (evaluation error: " + evaluation + ")";
    }
}
