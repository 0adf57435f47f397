package org.mcpkubernetes.identity;

import java.util.List;
import java.util.Map;

/**
 * Identity as handed over by the security layer, before any validation.
 */
public record RawIdentity(String subjectId, String email, List<String> groups, Map<String, List<String>> extra) {

    public RawIdentity(String subjectId, String email, List<String> groups) {
        this(subjectId, email, groups, Map.of());
    }
}
