package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AccessCheckInfo(String verb, String resource, String apiGroup, String namespace, String name,
        String subresource) {
}
