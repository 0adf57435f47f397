package org.mcpkubernetes.discovery;

import java.util.List;

public final class ClusterFilter {

    private ClusterFilter() {
    }

    /**
     * Applies all filters conjunctively. The selector is parsed before anything is matched, so an invalid selector
     * fails the whole call with {@link InvalidSelectorException}.
     */
    public static List<ClusterSummary> filter(List<ClusterSummary> clusters, ClusterListOptions options) {
        if (options == null || !options.isFiltered()) {
            return List.copyOf(clusters);
        }
        LabelSelector selector = LabelSelector.parse(options.labelSelector());
        return clusters.stream()
                .filter(cluster -> !ClusterListOptions.hasText(options.namespace())
                        || options.namespace().equals(cluster.namespace()))
                .filter(cluster -> !ClusterListOptions.hasText(options.provider())
                        || options.provider().equalsIgnoreCase(cluster.provider()))
                .filter(cluster -> !ClusterListOptions.hasText(options.status())
                        || options.status().equalsIgnoreCase(cluster.phase()))
                .filter(cluster -> !options.readyOnly() || cluster.ready())
                .filter(cluster -> selector.matches(cluster.labels()))
                .toList();
    }
}
