package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

public record ClusterDetailOutput(
        String name,
        String namespace,
        ClusterMetadataInfo metadata,
        ClusterStatusInfo status,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> labels,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> annotations) {
}
