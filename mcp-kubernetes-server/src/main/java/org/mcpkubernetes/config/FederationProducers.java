package org.mcpkubernetes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.jboss.logging.Logger;
import org.mcpkubernetes.access.SelfSubjectAccessReviewer;
import org.mcpkubernetes.federation.CacheConfig;
import org.mcpkubernetes.federation.CapiClusterSource;
import org.mcpkubernetes.federation.CapiResources;
import org.mcpkubernetes.federation.ClientCache;
import org.mcpkubernetes.federation.ClusterClientManager;
import org.mcpkubernetes.federation.ConnectivityChecker;
import org.mcpkubernetes.federation.ConnectivityConfig;
import org.mcpkubernetes.federation.FederationManager;
import org.mcpkubernetes.federation.ImpersonatingClientFactory;
import org.mcpkubernetes.federation.KubeconfigResolver;
import org.mcpkubernetes.identity.GroupMapper;
import org.mcpkubernetes.kubernetes.FederationSupport;
import org.mcpkubernetes.kubernetes.operations.ClusterOperations;
import org.mcpkubernetes.kubernetes.operations.DirectClusterOperations;
import org.mcpkubernetes.kubernetes.operations.FederatedClusterOperations;
import org.mcpkubernetes.metrics.FederationMetrics;
import org.mcpkubernetes.output.OutputConfig;
import org.mcpkubernetes.output.ResponseProcessor;

/**
 * Wires the federation layer and the response pipeline from {@link McpKubernetesConfig}.
 */
@ApplicationScoped
public class FederationProducers {

    private static final Logger LOG = Logger.getLogger(FederationProducers.class);

    @Produces
    @Singleton
    public OutputConfig outputConfig(McpKubernetesConfig config) {
        McpKubernetesConfig.Output output = config.output();
        OutputConfig outputConfig = new OutputConfig(
                output.maxItems(),
                output.maxClusters(),
                output.maxResponseBytes(),
                output.slimOutput(),
                output.maskSecrets(),
                output.summaryThreshold(),
                output.excludedFields().orElse(OutputConfig.DEFAULT_EXCLUDED_FIELDS)).validated();
        LOG.infof("Output limits: maxItems=%d maxClusters=%d maxResponseBytes=%d slim=%s maskSecrets=%s",
                outputConfig.maxItems(), outputConfig.maxClusters(), outputConfig.maxResponseBytes(),
                outputConfig.slimOutput(), outputConfig.maskSecrets());
        return outputConfig;
    }

    @Produces
    @Singleton
    public ResponseProcessor responseProcessor(OutputConfig outputConfig, ObjectMapper objectMapper) {
        return new ResponseProcessor(outputConfig, objectMapper);
    }

    @Produces
    @Singleton
    public FederationSupport federationSupport(McpKubernetesConfig config, KubernetesClient serviceClient,
            ObjectMapper objectMapper, FederationMetrics metrics) {
        if (!config.federation().enabled()) {
            LOG.info("Federation mode disabled; tools use the service account client only");
            return new FederationSupport(Optional.empty(), config.federation().requestTimeout());
        }
        McpKubernetesConfig.Cache cache = config.cache();
        McpKubernetesConfig.Connectivity connectivity = config.federation().connectivity();
        ConnectivityConfig connectivityConfig = new ConnectivityConfig(connectivity.connectionTimeout(),
                connectivity.requestTimeout(), connectivity.retryAttempts(), connectivity.retryBackoff(),
                connectivity.checkEnabled());
        GroupMapper groupMapper = GroupMapper.fromJson(config.federation().groupMappings().orElse(""), objectMapper);
        ConnectivityChecker connectivityChecker = new ConnectivityChecker(connectivityConfig, metrics);
        ClientCache clientCache = new ClientCache(new CacheConfig(cache.ttl(), cache.maxEntries(),
                cache.cleanupInterval()));
        clientCache.bindTo(metrics.registry());
        CapiClusterSource clusterSource = new CapiClusterSource(
                CapiResources.clusterContext(config.federation().capiVersion()));
        ClusterClientManager manager = new FederationManager(
                clientCache,
                new ImpersonatingClientFactory(serviceClient.getConfiguration(), config.federation().agentName(),
                        connectivityConfig),
                clusterSource,
                new KubeconfigResolver(clusterSource),
                new SelfSubjectAccessReviewer(),
                groupMapper,
                connectivityChecker,
                metrics);
        LOG.infof("Federation mode enabled: cache ttl=%s maxEntries=%d capiVersion=%s %s connectivityCheck=%s",
                cache.ttl(), cache.maxEntries(), config.federation().capiVersion(), groupMapper,
                connectivityChecker.enabled());
        return new FederationSupport(Optional.of(manager), config.federation().requestTimeout());
    }

    @Produces
    @Singleton
    public ClusterOperations clusterOperations(FederationSupport federationSupport, KubernetesClient serviceClient,
            ObjectMapper objectMapper) {
        return federationSupport.manager()
                .<ClusterOperations>map(manager -> new FederatedClusterOperations(manager, objectMapper))
                .orElseGet(() -> new DirectClusterOperations(serviceClient, objectMapper));
    }

    void closeFederation(@Disposes FederationSupport federationSupport) {
        federationSupport.manager().ifPresent(ClusterClientManager::close);
    }
}
