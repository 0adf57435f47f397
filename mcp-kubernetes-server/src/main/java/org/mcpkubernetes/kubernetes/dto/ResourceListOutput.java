package org.mcpkubernetes.kubernetes.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.mcpkubernetes.output.ProcessingMetadata;
import org.mcpkubernetes.output.ResourceSummary;
import org.mcpkubernetes.output.TruncationWarning;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceListOutput(
        List<Map<String, Object>> items,
        ResourceSummary summary,
        String continueToken,
        String resourceVersion,
        Long remainingItems,
        int totalItems,
        int returnedCount,
        boolean truncated,
        List<TruncationWarning> warnings,
        ProcessingMetadata metadata) {
}
