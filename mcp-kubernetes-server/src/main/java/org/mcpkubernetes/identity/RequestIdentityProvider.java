package org.mcpkubernetes.identity;

import io.quarkus.security.identity.SecurityIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.security.Principal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.jwt.JsonWebToken;

/**
 * Reads the identity that Quarkus security attached to the current MCP request.
 */
@ApplicationScoped
public class RequestIdentityProvider {

    static final String EMAIL_CLAIM = "email";

    private final SecurityIdentity securityIdentity;

    @Inject
    public RequestIdentityProvider(SecurityIdentity securityIdentity) {
        this.securityIdentity = securityIdentity;
    }

    public Optional<RawIdentity> current() {
        if (securityIdentity == null || securityIdentity.isAnonymous()) {
            return Optional.empty();
        }
        Principal principal = securityIdentity.getPrincipal();
        if (principal instanceof JsonWebToken jwt) {
            String email = jwt.getClaim(EMAIL_CLAIM);
            List<String> groups = jwt.getGroups() == null ? List.of() : new ArrayList<>(jwt.getGroups());
            return Optional.of(new RawIdentity(jwt.getSubject(), email, groups));
        }
        String name = principal == null ? null : principal.getName();
        return Optional.of(new RawIdentity(null, name, new ArrayList<>(securityIdentity.getRoles())));
    }
}
