package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ClusterResolveOutput(boolean resolved, ClusterListItem cluster, List<ClusterListItem> matches,
        String message) {
}
