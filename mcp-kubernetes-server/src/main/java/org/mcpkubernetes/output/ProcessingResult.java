package org.mcpkubernetes.output;

import java.util.List;
import java.util.Map;

public record ProcessingResult(List<Map<String, Object>> items, ProcessingMetadata metadata,
        List<TruncationWarning> warnings) {

    public int returnedCount() {
        return items.size();
    }

    public int totalCount() {
        return metadata.originalCount();
    }

    public boolean truncated() {
        return metadata.truncated();
    }
}
