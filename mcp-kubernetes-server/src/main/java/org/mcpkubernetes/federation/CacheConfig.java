package org.mcpkubernetes.federation;

import java.time.Duration;

public record CacheConfig(Duration ttl, int maxEntries, Duration cleanupInterval) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);

    public CacheConfig {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            ttl = DEFAULT_TTL;
        }
        if (maxEntries <= 0) {
            maxEntries = DEFAULT_MAX_ENTRIES;
        }
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_TTL, DEFAULT_MAX_ENTRIES, DEFAULT_CLEANUP_INTERVAL);
    }
}
