package org.mcpkubernetes.output;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replaces per-item detail with counts and a small, masked sample.
 */
public final class ResourceSummarizer {

    private ResourceSummarizer() {
    }

    public static ResourceSummary summarize(List<Map<String, Object>> items, SummaryOptions options) {
        Map<String, Integer> byStatus = new HashMap<>();
        Map<String, Integer> byNamespace = new HashMap<>();
        Map<String, Integer> byKind = new HashMap<>();

        for (Map<String, Object> item : items) {
            if (options.includeByStatus()) {
                increment(byStatus, status(item));
            }
            if (options.includeByNamespace()) {
                increment(byNamespace, JsonMaps.string(item, "metadata", "namespace"));
            }
            if (options.includeByKind()) {
                increment(byKind, JsonMaps.string(item, "kind"));
            }
        }

        List<Map<String, Object>> sample = items.stream()
                .limit(Math.max(0, options.maxSampleSize()))
                .map(SecretMasker::mask)
                .toList();

        return new ResourceSummary(
                items.size(),
                sortedByCount(byStatus, Integer.MAX_VALUE),
                sortedByCount(byNamespace, options.maxNamespaces()),
                byNamespace.size() > options.maxNamespaces(),
                sortedByCount(byKind, Integer.MAX_VALUE),
                sample,
                items.size() > options.maxSampleSize());
    }

    private static void increment(Map<String, Integer> counts, String key) {
        if (key != null && !key.isEmpty()) {
            counts.merge(key, 1, Integer::sum);
        }
    }

    /**
     * Top {@code limit} entries by count, descending, ties broken by key.
     */
    static Map<String, Integer> sortedByCount(Map<String, Integer> counts, int limit) {
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }

    static String status(Map<String, Object> item) {
        String kind = JsonMaps.string(item, "kind").toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "pod" -> orUnknown(JsonMaps.string(item, "status", "phase"));
            case "deployment", "replicaset", "statefulset", "daemonset" -> workloadStatus(item);
            case "node" -> nodeStatus(item);
            case "job" -> jobStatus(item);
            default -> JsonMaps.string(item, "status", "phase");
        };
    }

    private static String workloadStatus(Map<String, Object> item) {
        if (JsonMaps.nested(item, "status").isEmpty()) {
            return "Unknown";
        }
        long replicas = JsonMaps.number(item, "spec", "replicas");
        long ready = JsonMaps.number(item, "status", "readyReplicas");
        long available = JsonMaps.number(item, "status", "availableReplicas");
        if (replicas == 0) {
            return "Scaled to Zero";
        }
        if (ready >= replicas && available >= replicas) {
            return "Ready";
        }
        return ready > 0 ? "Partially Ready" : "Not Ready";
    }

    private static String nodeStatus(Map<String, Object> item) {
        for (Object condition : JsonMaps.list(item, "status", "conditions")) {
            Map<String, Object> map = JsonMaps.map(condition).orElse(Map.of());
            if ("Ready".equals(map.get("type"))) {
                return "True".equals(map.get("status")) ? "Ready" : "NotReady";
            }
        }
        return "Unknown";
    }

    private static String jobStatus(Map<String, Object> item) {
        for (Object condition : JsonMaps.list(item, "status", "conditions")) {
            Map<String, Object> map = JsonMaps.map(condition).orElse(Map.of());
            if ("True".equals(map.get("status"))) {
                if ("Complete".equals(map.get("type"))) {
                    return "Succeeded";
                }
                if ("Failed".equals(map.get("type"))) {
                    return "Failed";
                }
            }
        }
        if (JsonMaps.number(item, "status", "succeeded") > 0) {
            return "Succeeded";
        }
        if (JsonMaps.number(item, "status", "failed") > 0) {
            return "Failed";
        }
        return "Running";
    }

    private static String orUnknown(String value) {
        return value.isEmpty() ? "Unknown" : value;
    }
}
