package org.mcpkubernetes.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.identity.IdentityValidationException.Reason;

class IdentityNormalizerTest {

    @Test
    void trimsEmailAndKeepsGroups() {
        Identity identity = IdentityNormalizer.normalize(
                new RawIdentity("abc-123", "  jane@example.com ", List.of("devs", "ops")));

        assertThat(identity.email()).isEqualTo("jane@example.com");
        assertThat(identity.principal()).isEqualTo("jane@example.com");
        assertThat(identity.groups()).containsExactly("devs", "ops");
        assertThat(identity.hasSubjectId()).isTrue();
    }

    @Test
    void nullIdentityRequiresAuthentication() {
        assertThatThrownBy(() -> IdentityNormalizer.normalize(null))
                .isInstanceOfSatisfying(IdentityValidationException.class, e -> {
                    assertThat(e.reason()).isEqualTo(Reason.USER_INFO_REQUIRED);
                    assertThat(e.category()).isEqualTo(ErrorCategory.AUTHENTICATION);
                    assertThat(e.userFacingMessage()).isEqualTo("authentication required");
                });
    }

    @Nested
    @DisplayName("email")
    class Email {

        @Test
        void blankEmailIsMissing() {
            assertThatThrownBy(() -> IdentityNormalizer.normalize(new RawIdentity(null, "   ", List.of())))
                    .isInstanceOfSatisfying(IdentityValidationException.class,
                            e -> assertThat(e.reason()).isEqualTo(Reason.MISSING_EMAIL));
        }

        @Test
        void malformedEmailIsInvalidInput() {
            assertThatThrownBy(() -> IdentityNormalizer.normalize(new RawIdentity(null, "not-an-email", List.of())))
                    .isInstanceOfSatisfying(IdentityValidationException.class, e -> {
                        assertThat(e.reason()).isEqualTo(Reason.INVALID_EMAIL);
                        assertThat(e.category()).isEqualTo(ErrorCategory.INPUT_VALIDATION);
                        assertThat(e.userFacingMessage()).isEqualTo("invalid email provided");
                    });
        }

        @Test
        void overlongEmailIsRejected() {
            String email = "a".repeat(250) + "@x.io";
            assertThatThrownBy(() -> IdentityNormalizer.normalize(new RawIdentity(null, email, List.of())))
                    .isInstanceOf(IdentityValidationException.class)
                    .hasMessageContaining("exceeds maximum length");
        }

        @Test
        void controlCharactersAreRejected() {
            assertThatThrownBy(() -> IdentityNormalizer.normalize(
                    new RawIdentity(null, "jane\r\n@example.com", List.of())))
                    .isInstanceOf(IdentityValidationException.class);
        }

        @Test
        void internalMessageTruncatesTheValue() {
            assertThatThrownBy(() -> IdentityNormalizer.normalize(
                    new RawIdentity(null, "someone-with-a-very-long-name-but-no-at-sign", List.of())))
                    .hasMessageContaining("'someone-with-a-very-...'");
        }
    }

    @Nested
    @DisplayName("groups and extras")
    class GroupsAndExtras {

        @Test
        void emptyGroupNameIsRejected() {
            assertThatThrownBy(() -> IdentityNormalizer.normalize(
                    new RawIdentity(null, "jane@example.com", List.of("devs", ""))))
                    .isInstanceOfSatisfying(IdentityValidationException.class,
                            e -> assertThat(e.userFacingMessage()).isEqualTo("invalid group name provided"));
        }

        @Test
        void tooManyGroupsAreRejected() {
            List<String> groups = new ArrayList<>();
            for (int i = 0; i <= IdentityNormalizer.MAX_GROUP_COUNT; i++) {
                groups.add("group-" + i);
            }
            assertThatThrownBy(() -> IdentityNormalizer.normalize(new RawIdentity(null, "jane@example.com", groups)))
                    .hasMessageContaining("too many groups");
        }

        @Test
        void extraKeysMustBeHeaderSafe() {
            RawIdentity raw = new RawIdentity(null, "jane@example.com", List.of(),
                    Map.of("bad key", List.of("v")));
            assertThatThrownBy(() -> IdentityNormalizer.normalize(raw))
                    .isInstanceOfSatisfying(IdentityValidationException.class,
                            e -> assertThat(e.reason()).isEqualTo(Reason.INVALID_EXTRA));
        }

        @Test
        void tooManyExtrasAreRejected() {
            Map<String, List<String>> extra = new HashMap<>();
            for (int i = 0; i <= IdentityNormalizer.MAX_EXTRA_COUNT; i++) {
                extra.put("key" + i, List.of("v"));
            }
            assertThatThrownBy(() -> IdentityNormalizer.normalize(
                    new RawIdentity(null, "jane@example.com", List.of(), extra)))
                    .hasMessageContaining("too many extra headers");
        }

        @Test
        void subjectWithControlCharactersIsRejected() {
            assertThatThrownBy(() -> IdentityNormalizer.normalize(
                    new RawIdentity("sub\u0000", "jane@example.com", List.of())))
                    .isInstanceOf(IdentityValidationException.class);
        }
    }

    @Test
    void agentExtraAlwaysWinsOverCallerSuppliedAgent() {
        Identity identity = IdentityNormalizer.normalize(new RawIdentity("sub-1", "jane@example.com", List.of(),
                Map.of("agent", List.of("spoofed"), "team", List.of("blue"))));

        Map<String, List<String>> extras = IdentityNormalizer.impersonationExtras(identity, "mcp-kubernetes");

        assertThat(extras)
                .containsEntry("agent", List.of("mcp-kubernetes"))
                .containsEntry("sub", List.of("sub-1"))
                .containsEntry("team", List.of("blue"));
    }

    @Test
    void validateRejectsIdentityBuiltWithoutNormalization() {
        Identity unchecked = new Identity(null, "", List.of(), Map.of());

        assertThatThrownBy(() -> IdentityNormalizer.validate(unchecked))
                .isInstanceOfSatisfying(IdentityValidationException.class,
                        e -> assertThat(e.category()).isEqualTo(ErrorCategory.AUTHENTICATION));
    }
}
