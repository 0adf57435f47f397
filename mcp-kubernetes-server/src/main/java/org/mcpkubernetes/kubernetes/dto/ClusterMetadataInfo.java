package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ClusterMetadataInfo(
        String organization,
        String provider,
        String release,
        String kubernetesVersion,
        String createdAt,
        String age,
        String description) {
}
