package org.mcpkubernetes.discovery;

import java.util.List;
import java.util.Locale;

public final class ClusterPatternResolver {

    private ClusterPatternResolver() {
    }

    /**
     * An exact name match wins outright. Otherwise names containing the pattern (case-insensitive) are collected and
     * a single hit is resolved.
     */
    public static PatternResolution resolve(List<ClusterSummary> clusters, String pattern) {
        for (ClusterSummary cluster : clusters) {
            if (cluster.name() != null && cluster.name().equals(pattern)) {
                return new PatternResolution(true, cluster, List.of(cluster));
            }
        }
        String needle = pattern.toLowerCase(Locale.ROOT);
        List<ClusterSummary> matches = clusters.stream()
                .filter(cluster -> cluster.name() != null && cluster.name().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
        if (matches.size() == 1) {
            return new PatternResolution(true, matches.get(0), matches);
        }
        return new PatternResolution(false, null, matches);
    }
}
