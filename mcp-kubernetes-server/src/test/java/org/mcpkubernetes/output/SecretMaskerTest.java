package org.mcpkubernetes.output;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SecretMaskerTest {

    @Test
    @SuppressWarnings("unchecked")
    void redactsSecretValuesButKeepsKeys() {
        Map<String, Object> secret = Resources.secret("db-credentials");

        Map<String, Object> masked = SecretMasker.mask(secret);

        assertThat((Map<String, Object>) masked.get("data"))
                .containsOnlyKeys("password", "username")
                .containsEntry("password", SecretMasker.REDACTED)
                .containsEntry("username", SecretMasker.REDACTED);
        assertThat((Map<String, Object>) masked.get("stringData")).containsEntry("token", SecretMasker.REDACTED);
        assertThat(JsonMaps.string(masked, "metadata", "annotations", "kubernetes.io/service-account.name"))
                .isEqualTo(SecretMasker.REDACTED);
        assertThat(JsonMaps.string(masked, "metadata", "annotations", "team")).isEqualTo("platform");
        assertThat(masked).containsEntry("type", "Opaque");
    }

    @Test
    void leavesTheInputUntouched() {
        Map<String, Object> secret = Resources.secret("db-credentials");

        SecretMasker.mask(secret);

        assertThat(JsonMaps.string(secret, "data", "password")).isEqualTo("aHVudGVyMg==");
    }

    @Test
    void otherKindsAreCopiedAsIs() {
        Map<String, Object> pod = Resources.pod("default", "web-0", "Running");

        Map<String, Object> masked = SecretMasker.mask(pod);

        assertThat(masked).isEqualTo(pod).isNotSameAs(pod);
    }

    @Test
    void flagsLikelySensitiveResources() {
        assertThat(SecretMasker.containsSensitiveData("Secret", "anything")).isTrue();
        assertThat(SecretMasker.containsSensitiveData("ServiceAccount", "builder")).isTrue();
        assertThat(SecretMasker.containsSensitiveData("ConfigMap", "registry-auth")).isTrue();
        assertThat(SecretMasker.containsSensitiveData("ConfigMap", "nginx-conf")).isFalse();
        assertThat(SecretMasker.containsSensitiveData("Pod", "password-reset")).isFalse();
    }
}
