package org.mcpkubernetes.output;

import java.util.List;
import java.util.Map;

public record PaginatedResult(List<Map<String, Object>> items, String continueToken, String resourceVersion,
        Long remainingItems, int totalItems) {
}
