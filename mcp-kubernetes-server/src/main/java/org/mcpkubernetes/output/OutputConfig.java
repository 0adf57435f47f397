package org.mcpkubernetes.output;

import java.util.List;

/**
 * Limits and switches for the response pipeline. Built once at startup and passed to whoever needs it.
 */
public record OutputConfig(
        int maxItems,
        int maxClusters,
        long maxResponseBytes,
        boolean slimOutput,
        boolean maskSecrets,
        int summaryThreshold,
        List<String> excludedFields) {

    public static final int DEFAULT_MAX_ITEMS = 100;
    public static final int DEFAULT_MAX_CLUSTERS = 20;
    public static final long DEFAULT_MAX_RESPONSE_BYTES = 512L * 1024;
    public static final int DEFAULT_SUMMARY_THRESHOLD = 500;

    public static final int ABSOLUTE_MAX_ITEMS = 1000;
    public static final int ABSOLUTE_MAX_CLUSTERS = 100;
    public static final long ABSOLUTE_MAX_RESPONSE_BYTES = 2L * 1024 * 1024;

    public static final List<String> DEFAULT_EXCLUDED_FIELDS = List.of(
            "metadata.managedFields",
            "metadata.annotations[kubectl.kubernetes.io/last-applied-configuration]",
            "metadata.annotations[deployment.kubernetes.io/revision]",
            "status.conditions[*].lastTransitionTime",
            "status.conditions[*].lastProbeTime",
            "status.conditions[*].lastHeartbeatTime",
            "metadata.ownerReferences",
            "metadata.finalizers",
            "metadata.generation",
            "metadata.resourceVersion",
            "metadata.uid",
            "metadata.selfLink");

    public OutputConfig {
        excludedFields = excludedFields == null ? List.of() : List.copyOf(excludedFields);
    }

    public static OutputConfig defaults() {
        return new OutputConfig(DEFAULT_MAX_ITEMS, DEFAULT_MAX_CLUSTERS, DEFAULT_MAX_RESPONSE_BYTES, true, true,
                DEFAULT_SUMMARY_THRESHOLD, DEFAULT_EXCLUDED_FIELDS);
    }

    /**
     * Non-positive limits fall back to defaults, oversized ones are clamped to the absolute caps.
     */
    public OutputConfig validated() {
        int items = maxItems <= 0 ? DEFAULT_MAX_ITEMS : Math.min(maxItems, ABSOLUTE_MAX_ITEMS);
        int clusters = maxClusters <= 0 ? DEFAULT_MAX_CLUSTERS : Math.min(maxClusters, ABSOLUTE_MAX_CLUSTERS);
        long bytes = maxResponseBytes <= 0
                ? DEFAULT_MAX_RESPONSE_BYTES
                : Math.min(maxResponseBytes, ABSOLUTE_MAX_RESPONSE_BYTES);
        int threshold = summaryThreshold <= 0 ? DEFAULT_SUMMARY_THRESHOLD : summaryThreshold;
        List<String> fields = slimOutput && excludedFields.isEmpty() ? DEFAULT_EXCLUDED_FIELDS : excludedFields;
        return new OutputConfig(items, clusters, bytes, slimOutput, maskSecrets, threshold, fields);
    }

    public boolean shouldSummarize(int itemCount) {
        return itemCount > summaryThreshold;
    }
}
