package org.mcpkubernetes.discovery;

/**
 * Filters for cluster listings. Every field is optional.
 *
 * @param namespace     organization namespace, exact match
 * @param provider      infrastructure provider, case-insensitive
 * @param status        cluster phase, case-insensitive
 * @param readyOnly     keep only ready clusters
 * @param labelSelector Kubernetes label selector
 */
public record ClusterListOptions(String namespace, String provider, String status, boolean readyOnly,
        String labelSelector) {

    public static ClusterListOptions none() {
        return new ClusterListOptions(null, null, null, false, null);
    }

    public boolean isFiltered() {
        return hasText(namespace) || hasText(provider) || hasText(status) || readyOnly || hasText(labelSelector);
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
