package org.mcpkubernetes.identity;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical identity used for impersonation and as part of client cache keys. Obtain instances through
 * {@link IdentityNormalizer#normalize(RawIdentity)}.
 *
 * @param subjectId optional subject claim, forwarded as the {@code sub} impersonation extra
 * @param email     impersonation user name
 * @param groups    impersonation groups
 * @param extra     additional impersonation extras, without the agent marker
 */
public record Identity(String subjectId, String email, List<String> groups, Map<String, List<String>> extra) {

    public Identity {
        groups = groups == null ? List.of() : List.copyOf(groups);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public String principal() {
        return email;
    }

    /**
     * Client cache principal: the email plus a digest of the subject, groups and extras. Any change to what is sent
     * as impersonation headers yields a different key, so a client built for an older group set is never reused.
     */
    public String impersonationKey() {
        StringBuilder canonical = new StringBuilder();
        appendField(canonical, subjectId == null ? "" : subjectId);
        groups.stream().sorted().forEach(group -> appendField(canonical, "g=" + group));
        new TreeMap<>(extra).forEach((key, values) -> {
            appendField(canonical, "x=" + key);
            values.stream().sorted().forEach(value -> appendField(canonical, value));
        });
        return email + "#" + UserHash.digest(canonical.toString());
    }

    private static void appendField(StringBuilder canonical, String value) {
        canonical.append(value.length()).append(':').append(value);
    }

    public boolean hasSubjectId() {
        return subjectId != null && !subjectId.isBlank();
    }
}
