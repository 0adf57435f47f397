package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ClusterListItem(
        String name,
        String namespace,
        String organization,
        String provider,
        String release,
        String status,
        boolean ready,
        String age,
        Integer nodeCount) {
}
