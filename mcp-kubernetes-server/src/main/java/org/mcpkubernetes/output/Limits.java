package org.mcpkubernetes.output;

public final class Limits {

    private Limits() {
    }

    /**
     * Limit actually applied to a request. A non-positive request uses the configured limit; a positive one is
     * capped by it. The absolute cap always wins and requests above it are capped, never rejected.
     */
    public static int effectiveLimit(int requested, int configured, int absoluteCap) {
        int base = configured <= 0 ? Math.min(OutputConfig.DEFAULT_MAX_ITEMS, absoluteCap) : configured;
        int effective = requested <= 0 ? base : Math.min(requested, base);
        return Math.min(effective, absoluteCap);
    }

    /**
     * Request-driven limit: a non-positive request gets {@code defaultLimit}, anything above {@code cap} is capped.
     */
    public static int clamp(int requested, int defaultLimit, int cap) {
        if (requested <= 0) {
            return Math.min(defaultLimit, cap);
        }
        return Math.min(requested, cap);
    }
}
