package org.mcpkubernetes.kubernetes;

import io.quarkiverse.mcp.server.ToolCallException;
import org.jboss.logging.Logger;
import org.mcpkubernetes.federation.ErrorCategory;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.IdentityNormalizer;
import org.mcpkubernetes.identity.IdentityValidationException;
import org.mcpkubernetes.identity.RawIdentity;
import org.mcpkubernetes.identity.RequestIdentityProvider;

final class ToolIdentities {

    private static final Logger LOG = Logger.getLogger(ToolIdentities.class);

    private ToolIdentities() {
    }

    /**
     * Current caller, normalized. A missing identity fails with {@code missingMessage}; a malformed one is rethrown
     * as {@link IdentityValidationException} so the calling tool decides how to present it.
     */
    static Identity require(RequestIdentityProvider identities, String missingMessage) {
        RawIdentity raw = identities.current().orElseThrow(() -> new ToolCallException(missingMessage));
        try {
            return IdentityNormalizer.normalize(raw);
        } catch (IdentityValidationException e) {
            if (e.category() == ErrorCategory.AUTHENTICATION) {
                LOG.debugf("Rejecting request without usable identity: %s", e.reason());
                throw new ToolCallException(missingMessage);
            }
            throw e;
        }
    }
}
