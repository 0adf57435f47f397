package org.mcpkubernetes.kubernetes.dto;

import java.util.List;

public record ClusterListOutput(List<ClusterListItem> clusters, int totalCount, int returnedCount, boolean truncated,
        boolean filterApplied) {
}
