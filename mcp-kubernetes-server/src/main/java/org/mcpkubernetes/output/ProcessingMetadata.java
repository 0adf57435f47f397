package org.mcpkubernetes.output;

import java.time.Instant;

public record ProcessingMetadata(Instant processedAt, int originalCount, int finalCount, boolean truncated,
        boolean slimApplied, boolean secretsMasked) {
}
