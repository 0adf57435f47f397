package org.mcpkubernetes.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TruncationWarning(int shown, int total, String message, boolean suggestSummary,
        List<String> suggestFilters) {

    static final int SUGGEST_SUMMARY_ABOVE = OutputConfig.DEFAULT_MAX_ITEMS * 5;

    public static TruncationWarning forItems(int shown, int total) {
        String message = String.format("Output truncated. Showing %d of %d items. Refine your query with "
                + "namespace, label, or field filters for complete results.", shown, total);
        if (total > SUGGEST_SUMMARY_ABOVE) {
            return new TruncationWarning(shown, total, message, true, List.of(
                    "Use labelSelector to filter by labels (e.g., app=nginx)",
                    "Use namespace to limit to a specific namespace",
                    "Use summary=true to get counts instead of full objects"));
        }
        return new TruncationWarning(shown, total, message, false, List.of());
    }

    public static TruncationWarning forResponseSize(int shown, int total, long maxBytes) {
        return new TruncationWarning(shown, total, String.format("Output truncated to stay under %d bytes. "
                + "Showing %d of %d items.", maxBytes, shown, total), total > SUGGEST_SUMMARY_ABOVE, List.of());
    }

    public static TruncationWarning forClusters(int shown, int total) {
        String message = String.format("Cluster results truncated. Showing %d of %d clusters. Name the clusters or "
                + "filter them by label to narrow results.", shown, total);
        return new TruncationWarning(shown, total, message, false, List.of(
                "Use clusters to name the clusters to query",
                "Use clusterLabelSelector to filter clusters by label",
                "Use maxClusters to raise the limit, up to " + OutputConfig.ABSOLUTE_MAX_CLUSTERS));
    }
}
