package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClusterStatusInfo(String phase, boolean ready, boolean controlPlaneReady, boolean infrastructureReady,
        Integer nodeCount) {
}
