package org.mcpkubernetes.discovery;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the fields discovery needs out of an untyped CAPI {@code Cluster} object.
 */
public final class ClusterSummaryMapper {

    private ClusterSummaryMapper() {
    }

    public static ClusterSummary toSummary(GenericKubernetesResource cluster) {
        ObjectMeta metadata = Optional.ofNullable(cluster.getMetadata()).orElseGet(ObjectMeta::new);
        Map<String, Object> properties = cluster.getAdditionalProperties();

        String phase = string(properties, "status", "phase").orElse(ClusterSummary.PHASE_UNKNOWN);
        boolean controlPlaneReady = bool(properties, "status", "controlPlaneReady");
        boolean infrastructureReady = bool(properties, "status", "infrastructureReady");
        boolean ready = controlPlaneReady && infrastructureReady && ClusterSummary.PHASE_PROVISIONED.equals(phase);

        Map<String, String> labels = metadata.getLabels() == null ? Map.of() : metadata.getLabels();

        return new ClusterSummary(
                metadata.getName(),
                metadata.getNamespace(),
                provider(string(properties, "spec", "infrastructureRef", "kind").orElse(null)),
                labels.getOrDefault(ClusterSummary.LABEL_RELEASE, ""),
                kubernetesVersion(properties),
                phase,
                ready,
                controlPlaneReady,
                infrastructureReady,
                nodeCount(properties),
                parseTimestamp(metadata.getCreationTimestamp()),
                labels,
                metadata.getAnnotations());
    }

    static String provider(String infrastructureKind) {
        if (infrastructureKind == null || infrastructureKind.isBlank()) {
            return "unknown";
        }
        String kind = infrastructureKind.toLowerCase(Locale.ROOT);
        if (kind.contains("aws")) {
            return "aws";
        }
        if (kind.contains("azure")) {
            return "azure";
        }
        if (kind.contains("vsphere")) {
            return "vsphere";
        }
        if (kind.contains("gcp") || kind.contains("google")) {
            return "gcp";
        }
        return kind.endsWith("cluster") ? kind.substring(0, kind.length() - "cluster".length()) : kind;
    }

    private static String kubernetesVersion(Map<String, Object> properties) {
        return string(properties, "spec", "topology", "version")
                .or(() -> string(properties, "status", "version"))
                .or(() -> string(properties, "spec", "controlPlaneRef", "version"))
                .orElse("");
    }

    private static Integer nodeCount(Map<String, Object> properties) {
        return number(properties, "status", "workerNodes")
                .or(() -> number(properties, "status", "readyReplicas"))
                .map(Number::intValue)
                .orElse(null);
    }

    private static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Optional<Object> nested(Map<String, Object> root, String... path) {
        Object current = root;
        for (String segment : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    private static Optional<String> string(Map<String, Object> root, String... path) {
        return nested(root, path).map(Object::toString).filter(value -> !value.isBlank());
    }

    private static Optional<Number> number(Map<String, Object> root, String... path) {
        return nested(root, path).filter(Number.class::isInstance).map(Number.class::cast);
    }

    private static boolean bool(Map<String, Object> root, String... path) {
        return nested(root, path).map(value -> Boolean.parseBoolean(value.toString())).orElse(false);
    }
}
