package org.mcpkubernetes.discovery;

import java.util.List;

/**
 * @param resolved whether exactly one cluster was selected
 * @param cluster  the selected cluster, or {@code null}
 * @param matches  every candidate that matched the pattern
 */
public record PatternResolution(boolean resolved, ClusterSummary cluster, List<ClusterSummary> matches) {

    public PatternResolution {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
