package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.IdentityNormalizer;

final class Impersonation {

    private Impersonation() {
    }

    /**
     * Copy of {@code base} that sends Impersonate-User, Impersonate-Group and Impersonate-Extra headers for the
     * given identity. Any impersonation already present in {@code base} is replaced.
     */
    static Config apply(Config base, Identity identity, String agentName) {
        return new ConfigBuilder(base)
                .withImpersonateUsername(identity.email())
                .withImpersonateGroups(identity.groups().toArray(new String[0]))
                .withImpersonateExtras(IdentityNormalizer.impersonationExtras(identity, agentName))
                .build();
    }
}
