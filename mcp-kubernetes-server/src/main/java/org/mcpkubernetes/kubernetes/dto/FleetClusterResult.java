package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Counts for one cluster of a fleet query. {@code byStatus} covers the first page only when
 * {@code statusFromFirstPage} is set; {@code error} replaces the counts when the cluster could not be queried.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FleetClusterResult(String cluster, Integer totalItems, Map<String, Integer> byStatus,
        Boolean statusFromFirstPage, String error) {

    public static FleetClusterResult failed(String cluster, String error) {
        return new FleetClusterResult(cluster, null, null, null, error);
    }
}
