package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanIResponse(boolean allowed, Boolean denied, String reason, String user, String cluster,
        AccessCheckInfo check) {
}
