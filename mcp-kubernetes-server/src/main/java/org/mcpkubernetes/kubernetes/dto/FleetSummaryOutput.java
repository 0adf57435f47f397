package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.mcpkubernetes.output.TruncationWarning;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FleetSummaryOutput(
        String kind,
        int totalItems,
        Map<String, Integer> byStatus,
        List<FleetClusterResult> clusters,
        int clustersQueried,
        int clustersFailed,
        int clustersMatched,
        boolean truncated,
        List<TruncationWarning> warnings) {
}
