package org.mcpkubernetes.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Renames caller groups before impersonation, for clusters whose RBAC bindings use different group names than the
 * identity provider. Unmapped groups pass through unchanged and order is preserved.
 */
public final class GroupMapper {

    private static final Logger LOG = Logger.getLogger(GroupMapper.class);

    private static final GroupMapper NONE = new GroupMapper(Map.of());

    private final Map<String, String> mappings;

    private GroupMapper(Map<String, String> mappings) {
        this.mappings = mappings;
    }

    public static GroupMapper none() {
        return NONE;
    }

    /**
     * @throws IllegalArgumentException for blank names, control characters, or two sources sharing one target
     */
    public static GroupMapper of(Map<String, String> mappings) {
        if (mappings == null || mappings.isEmpty()) {
            return NONE;
        }
        Map<String, String> sourceByTarget = new HashMap<>();
        mappings.forEach((source, target) -> {
            if (source == null || source.isBlank()) {
                throw new IllegalArgumentException("invalid group mappings: source group must not be empty");
            }
            if (IdentityNormalizer.containsControlCharacters(source)) {
                throw new IllegalArgumentException("invalid group mappings: source group '" + source
                        + "' contains control characters");
            }
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("invalid group mappings: target group for source '" + source
                        + "' must not be empty");
            }
            if (IdentityNormalizer.containsControlCharacters(target)) {
                throw new IllegalArgumentException("invalid group mappings: target group for source '" + source
                        + "' contains control characters");
            }
            String previous = sourceByTarget.putIfAbsent(target, source);
            if (previous != null) {
                throw new IllegalArgumentException("invalid group mappings: duplicate target group '" + target
                        + "' mapped from '" + previous + "' and '" + source + "'");
            }
        });
        GroupMapper mapper = new GroupMapper(Map.copyOf(mappings));
        LOG.infof("Group mapper initialized with %d mappings", mappings.size());
        return mapper;
    }

    /**
     * Parses a JSON object of source to target group names, e.g. {@code {"okta-admins":"cluster-admins"}}.
     * Blank input means no mapping.
     */
    public static GroupMapper fromJson(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return NONE;
        }
        try {
            return of(objectMapper.readValue(json, new TypeReference<Map<String, String>>() {
            }));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid group mappings: expected a JSON object of strings", e);
        }
    }

    public Identity apply(Identity identity) {
        if (mappings.isEmpty() || identity == null || identity.groups().stream().noneMatch(mappings::containsKey)) {
            return identity;
        }
        List<String> mapped = identity.groups().stream()
                .map(group -> {
                    String target = mappings.get(group);
                    if (target == null) {
                        return group;
                    }
                    LOG.debugf("Group %s mapped to %s for %s", group, target, UserHash.of(identity));
                    return target;
                })
                .toList();
        return new Identity(identity.subjectId(), identity.email(), mapped, identity.extra());
    }

    public int size() {
        return mappings.size();
    }

    @Override
    public String toString() {
        return mappings.isEmpty() ? "GroupMapper{disabled}" : "GroupMapper{mappings=" + mappings.size() + "}";
    }
}
