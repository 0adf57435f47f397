package org.mcpkubernetes.output;

/**
 * @param maxSampleSize       number of raw items kept in the sample
 * @param maxNamespaces       number of namespaces kept in {@code byNamespace}, largest first
 * @param includeByStatus     group by derived status
 * @param includeByNamespace  group by namespace
 * @param includeByKind       group by kind
 */
public record SummaryOptions(int maxSampleSize, int maxNamespaces, boolean includeByStatus,
        boolean includeByNamespace, boolean includeByKind) {

    public static final int DEFAULT_MAX_SAMPLE_SIZE = 10;
    public static final int DEFAULT_MAX_NAMESPACES = 10;

    public static SummaryOptions defaults() {
        return new SummaryOptions(DEFAULT_MAX_SAMPLE_SIZE, DEFAULT_MAX_NAMESPACES, true, true, false);
    }
}
