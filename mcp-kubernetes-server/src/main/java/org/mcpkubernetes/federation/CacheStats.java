package org.mcpkubernetes.federation;

import java.time.Duration;

public record CacheStats(int cacheSize, long hits, long misses, long evictions, int maxEntries, Duration ttl,
        boolean closed) {
}
