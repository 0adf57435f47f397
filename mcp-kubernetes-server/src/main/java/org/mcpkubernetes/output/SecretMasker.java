package org.mcpkubernetes.output;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Redacts credential material from resources before they leave the process.
 */
public final class SecretMasker {

    public static final String REDACTED = "***REDACTED***";

    private static final Set<String> SENSITIVE_ANNOTATIONS = Set.of(
            "kubernetes.io/service-account.uid",
            "kubernetes.io/service-account.name",
            "kubernetes.io/service-account-token");

    private static final Set<String> SENSITIVE_NAME_HINTS = Set.of(
            "credentials", "password", "secret", "auth", "token", "kubeconfig");

    private SecretMasker() {
    }

    /**
     * Returns a masked copy; the input is left untouched. Non-secret objects are copied as they are.
     */
    public static Map<String, Object> mask(Map<String, Object> resource) {
        Map<String, Object> copy = JsonMaps.deepCopy(resource);
        if (!"Secret".equals(copy.get("kind"))) {
            return copy;
        }
        redactValues(copy.get("data"));
        redactValues(copy.get("stringData"));
        JsonMaps.nested(copy, "metadata", "annotations").flatMap(JsonMaps::map).ifPresent(annotations ->
                SENSITIVE_ANNOTATIONS.forEach(key -> annotations.computeIfPresent(key, (k, v) -> REDACTED)));
        return copy;
    }

    private static void redactValues(Object section) {
        JsonMaps.map(section).ifPresent(values -> values.replaceAll((key, value) -> REDACTED));
    }

    public static boolean isSecret(Map<String, Object> resource) {
        return "Secret".equals(resource.get("kind"));
    }

    /**
     * Whether a resource of this kind and name is likely to carry credentials.
     */
    public static boolean containsSensitiveData(String kind, String name) {
        String lowerKind = kind == null ? "" : kind.toLowerCase(Locale.ROOT);
        if (lowerKind.equals("secret") || lowerKind.equals("serviceaccount")) {
            return true;
        }
        if (lowerKind.equals("configmap") && name != null) {
            String lowerName = name.toLowerCase(Locale.ROOT);
            return SENSITIVE_NAME_HINTS.stream().anyMatch(lowerName::contains);
        }
        return false;
    }
}
