package org.mcpkubernetes.identity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.mcpkubernetes.identity.IdentityValidationException.Reason;

/**
 * Validates identities before they are allowed anywhere near an impersonation header.
 */
public final class IdentityNormalizer {

    public static final int MAX_EMAIL_LENGTH = 254;
    public static final int MAX_GROUP_NAME_LENGTH = 256;
    public static final int MAX_GROUP_COUNT = 100;
    public static final int MAX_EXTRA_KEY_LENGTH = 256;
    public static final int MAX_EXTRA_VALUE_LENGTH = 1024;
    public static final int MAX_EXTRA_COUNT = 50;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern EXTRA_KEY = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private IdentityNormalizer() {
    }

    public static Identity normalize(RawIdentity raw) {
        if (raw == null) {
            throw new IdentityValidationException(Reason.USER_INFO_REQUIRED, null, "no identity present");
        }
        String email = raw.email() == null ? "" : raw.email().trim();
        validateEmail(email);
        List<String> groups = raw.groups() == null ? List.of() : raw.groups();
        validateGroups(groups);
        Map<String, List<String>> extra = raw.extra() == null ? Map.of() : raw.extra();
        validateExtra(extra);
        String subjectId = raw.subjectId();
        if (subjectId != null && containsControlCharacters(subjectId)) {
            throw new IdentityValidationException(Reason.INVALID_EXTRA, subjectId, "subject contains control characters");
        }
        return new Identity(subjectId, email, groups, extra);
    }

    /**
     * Re-checks an identity that was built elsewhere. Used by the federation layer so no code path can skip validation.
     */
    public static Identity validate(Identity identity) {
        if (identity == null) {
            throw new IdentityValidationException(Reason.USER_INFO_REQUIRED, null, "no identity present");
        }
        return normalize(new RawIdentity(identity.subjectId(), identity.email(), identity.groups(), identity.extra()));
    }

    /**
     * Extras sent with impersonated requests: caller extras, {@code sub}, then the agent marker, which always wins.
     */
    public static Map<String, List<String>> impersonationExtras(Identity identity, String agentName) {
        Map<String, List<String>> extras = new LinkedHashMap<>(identity.extra());
        if (identity.hasSubjectId()) {
            extras.put("sub", List.of(identity.subjectId()));
        }
        extras.put("agent", List.of(agentName));
        return extras;
    }

    private static void validateEmail(String email) {
        if (email.isEmpty()) {
            throw new IdentityValidationException(Reason.MISSING_EMAIL, email, "email is empty");
        }
        if (email.length() > MAX_EMAIL_LENGTH) {
            throw new IdentityValidationException(Reason.INVALID_EMAIL, email,
                    "exceeds maximum length of " + MAX_EMAIL_LENGTH);
        }
        if (containsControlCharacters(email)) {
            throw new IdentityValidationException(Reason.INVALID_EMAIL, email, "contains control characters");
        }
        if (!EMAIL.matcher(email).matches()) {
            throw new IdentityValidationException(Reason.INVALID_EMAIL, email, "invalid email format");
        }
    }

    private static void validateGroups(List<String> groups) {
        if (groups.size() > MAX_GROUP_COUNT) {
            throw new IdentityValidationException(Reason.INVALID_GROUP_NAME, String.valueOf(groups.size()),
                    "too many groups (max " + MAX_GROUP_COUNT + ")");
        }
        for (String group : groups) {
            if (group == null || group.isEmpty()) {
                throw new IdentityValidationException(Reason.INVALID_GROUP_NAME, group, "group name is empty");
            }
            if (group.length() > MAX_GROUP_NAME_LENGTH) {
                throw new IdentityValidationException(Reason.INVALID_GROUP_NAME, group,
                        "exceeds maximum length of " + MAX_GROUP_NAME_LENGTH);
            }
            if (containsControlCharacters(group)) {
                throw new IdentityValidationException(Reason.INVALID_GROUP_NAME, group, "contains control characters");
            }
        }
    }

    private static void validateExtra(Map<String, List<String>> extra) {
        if (extra.size() > MAX_EXTRA_COUNT) {
            throw new IdentityValidationException(Reason.INVALID_EXTRA, String.valueOf(extra.size()),
                    "too many extra headers (max " + MAX_EXTRA_COUNT + ")");
        }
        for (Map.Entry<String, List<String>> entry : extra.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.length() > MAX_EXTRA_KEY_LENGTH || !EXTRA_KEY.matcher(key).matches()) {
                throw new IdentityValidationException(Reason.INVALID_EXTRA, key, "invalid extra header key");
            }
            List<String> values = entry.getValue() == null ? List.of() : new ArrayList<>(entry.getValue());
            for (String value : values) {
                if (value == null || value.length() > MAX_EXTRA_VALUE_LENGTH || containsControlCharacters(value)) {
                    throw new IdentityValidationException(Reason.INVALID_EXTRA, key, "invalid extra header value");
                }
            }
        }
    }

    static boolean containsControlCharacters(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
