package org.mcpkubernetes.access;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EvaluationErrorSanitizerTest {

    @Test
    void emptyInputStaysEmpty() {
        assertThat(EvaluationErrorSanitizer.sanitize("")).isEmpty();
        assertThat(EvaluationErrorSanitizer.sanitize(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "unable to find resource X|resource type not recognized",
            "no matches for kind Widget in group custom.io|resource type not recognized",
            "webhook authz.internal.corp:8443 denied the request|policy evaluation failed",
            "Admission Controller rejected|policy evaluation failed",
            "context deadline exceeded calling authorizer|permission check timed out",
            "Internal Error: nil pointer|internal evaluation error",
            "something nobody anticipated at 10.0.0.7|unable to evaluate permissions"
    })
    void mapsToFixedMessages(String raw, String expected) {
        assertThat(EvaluationErrorSanitizer.sanitize(raw)).isEqualTo(expected);
    }

    @Test
    void firstMatchingRuleWins() {
        assertThat(EvaluationErrorSanitizer.sanitize("webhook not found")).isEqualTo("resource type not recognized");
    }

    @Test
    void displayReasonNeverLeaksRawEvaluationText() {
        AccessCheckResult result = new AccessCheckResult(false, false, "",
                "unable to find resource definition for custom.io/v1");

        String reason = EvaluationErrorSanitizer.displayReason(result);

        assertThat(reason).isEqualTo("evaluation error: resource type not recognized").doesNotContain("custom.io");
    }

    @Test
    void displayReasonCombinesAuthorizerReason() {
        AccessCheckResult result = new AccessCheckResult(false, true, "RBAC: denied", "webhook timeout");

        assertThat(EvaluationErrorSanitizer.displayReason(result))
                .isEqualTo("RBAC: denied (evaluation error: policy evaluation failed)");
        assertThat(EvaluationErrorSanitizer.displayReason(new AccessCheckResult(true, false, "RBAC: allowed", "")))
                .isEqualTo("RBAC: allowed");
    }
}
