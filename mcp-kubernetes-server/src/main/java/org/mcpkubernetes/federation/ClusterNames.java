package org.mcpkubernetes.federation;

import java.util.regex.Pattern;

public final class ClusterNames {

    public static final String LOCAL = "";
    public static final int MAX_LENGTH = 253;

    private static final Pattern DNS_1123 = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");

    private ClusterNames() {
    }

    public static boolean isLocal(String clusterName) {
        return clusterName == null || clusterName.isEmpty();
    }

    public static String normalize(String clusterName) {
        return clusterName == null ? LOCAL : clusterName.trim();
    }

    public static void validate(String clusterName) {
        if (clusterName == null || clusterName.isEmpty()) {
            throw new InvalidClusterNameException("cluster name is empty");
        }
        if (clusterName.length() > MAX_LENGTH) {
            throw new InvalidClusterNameException("exceeds maximum length of " + MAX_LENGTH);
        }
        if (clusterName.contains("..") || clusterName.contains("/") || clusterName.contains("\\")) {
            throw new InvalidClusterNameException("contains path characters");
        }
        if (!DNS_1123.matcher(clusterName).matches()) {
            throw new InvalidClusterNameException("must be a lowercase DNS-1123 label");
        }
    }

    public static String display(String clusterName) {
        return isLocal(clusterName) ? "local" : clusterName;
    }
}
