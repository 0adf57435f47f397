package org.mcpkubernetes.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ResourceSummary(
        int total,
        Map<String, Integer> byStatus,
        Map<String, Integer> byNamespace,
        boolean namespacesTruncated,
        Map<String, Integer> byKind,
        List<Map<String, Object>> sample,
        boolean hasMore) {

    /**
     * Same counts with a replaced sample, e.g. after response shaping dropped some of it.
     */
    public ResourceSummary withSample(List<Map<String, Object>> shapedSample, boolean sampleTruncated) {
        return new ResourceSummary(total, byStatus, byNamespace, namespacesTruncated, byKind, shapedSample,
                hasMore || sampleTruncated);
    }
}
