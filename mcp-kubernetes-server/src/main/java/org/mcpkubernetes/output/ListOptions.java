package org.mcpkubernetes.output;

/**
 * List request parameters. {@code continueToken} is opaque and passed back to the API server unchanged.
 */
public record ListOptions(String labelSelector, String fieldSelector, boolean allNamespaces, int limit,
        String continueToken) {

    public ListOptions withLimit(int newLimit) {
        return new ListOptions(labelSelector, fieldSelector, allNamespaces, newLimit, continueToken);
    }
}
