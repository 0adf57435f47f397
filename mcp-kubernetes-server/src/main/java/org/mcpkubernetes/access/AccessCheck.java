package org.mcpkubernetes.access;

/**
 * A single "can I" question. Only {@code verb} and {@code resource} are required.
 */
public record AccessCheck(String verb, String resource, String apiGroup, String namespace, String name,
        String subresource) {

    public static AccessCheck of(String verb, String resource) {
        return new AccessCheck(verb, resource, null, null, null, null);
    }
}
