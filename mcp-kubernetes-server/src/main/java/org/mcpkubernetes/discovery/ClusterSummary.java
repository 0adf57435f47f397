package org.mcpkubernetes.discovery;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of one CAPI {@code Cluster}, taken during a single discovery call.
 */
public record ClusterSummary(
        String name,
        String namespace,
        String provider,
        String release,
        String kubernetesVersion,
        String phase,
        boolean ready,
        boolean controlPlaneReady,
        boolean infrastructureReady,
        Integer nodeCount,
        Instant createdAt,
        Map<String, String> labels,
        Map<String, String> annotations) {

    public static final String PHASE_PENDING = "Pending";
    public static final String PHASE_PROVISIONING = "Provisioning";
    public static final String PHASE_PROVISIONED = "Provisioned";
    public static final String PHASE_DELETING = "Deleting";
    public static final String PHASE_FAILED = "Failed";
    public static final String PHASE_UNKNOWN = "Unknown";

    public static final String LABEL_ORGANIZATION = "giantswarm.io/organization";
    public static final String LABEL_RELEASE = "release.giantswarm.io/version";
    public static final String ANNOTATION_DESCRIPTION = "cluster.giantswarm.io/description";

    public ClusterSummary {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        phase = phase == null || phase.isBlank() ? PHASE_UNKNOWN : phase;
    }

    /**
     * Organization label, or the namespace when the label is absent.
     */
    public String organization() {
        String organization = labels.get(LABEL_ORGANIZATION);
        return organization == null || organization.isBlank() ? namespace : organization;
    }

    public String description() {
        return annotations.get(ANNOTATION_DESCRIPTION);
    }

    public String age(Instant now) {
        if (createdAt == null) {
            return "";
        }
        Duration age = Duration.between(createdAt, now);
        if (age.isNegative() || age.toMinutes() < 1) {
            return "<1m";
        }
        if (age.toHours() < 1) {
            return age.toMinutes() + "m";
        }
        if (age.toDays() < 1) {
            return age.toHours() + "h";
        }
        return age.toDays() + "d";
    }
}
