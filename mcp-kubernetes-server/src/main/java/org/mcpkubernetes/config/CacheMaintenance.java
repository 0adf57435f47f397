package org.mcpkubernetes.config;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.mcpkubernetes.kubernetes.FederationSupport;

@ApplicationScoped
public class CacheMaintenance {

    private static final Logger LOG = Logger.getLogger(CacheMaintenance.class);

    private final FederationSupport federation;

    @Inject
    public CacheMaintenance(FederationSupport federation) {
        this.federation = federation;
    }

    @Scheduled(every = "${mcp.kubernetes.cache.cleanup-interval:1m}", delayed = "30s",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void evictExpiredClients() {
        federation.manager().ifPresent(manager -> {
            int evicted = manager.evictExpired();
            if (evicted > 0) {
                LOG.debugf("Evicted %d expired cluster clients", evicted);
            }
        });
    }
}
