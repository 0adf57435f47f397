package org.mcpkubernetes.federation;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.List;
import org.jboss.logging.Logger;
import org.mcpkubernetes.access.AccessCheck;
import org.mcpkubernetes.access.AccessCheckResult;
import org.mcpkubernetes.access.AccessChecks;
import org.mcpkubernetes.access.SelfSubjectAccessReviewer;
import org.mcpkubernetes.discovery.ClusterSummary;
import org.mcpkubernetes.identity.GroupMapper;
import org.mcpkubernetes.identity.Identity;
import org.mcpkubernetes.identity.IdentityNormalizer;
import org.mcpkubernetes.identity.UserHash;
import org.mcpkubernetes.metrics.FederationMetrics;

public class FederationManager implements ClusterClientManager {

    private static final Logger LOG = Logger.getLogger(FederationManager.class);

    private final ClientCache cache;
    private final ClusterClientFactory clientFactory;
    private final CapiClusterSource clusterSource;
    private final KubeconfigResolver kubeconfigResolver;
    private final SelfSubjectAccessReviewer accessReviewer;
    private final GroupMapper groupMapper;
    private final ConnectivityChecker connectivityChecker;
    private final FederationMetrics metrics;

    public FederationManager(ClientCache cache, ClusterClientFactory clientFactory, CapiClusterSource clusterSource,
            KubeconfigResolver kubeconfigResolver, SelfSubjectAccessReviewer accessReviewer) {
        this(cache, clientFactory, clusterSource, kubeconfigResolver, accessReviewer, GroupMapper.none(),
                ConnectivityChecker.disabled(), FederationMetrics.noop());
    }

    public FederationManager(ClientCache cache, ClusterClientFactory clientFactory, CapiClusterSource clusterSource,
            KubeconfigResolver kubeconfigResolver, SelfSubjectAccessReviewer accessReviewer, GroupMapper groupMapper,
            ConnectivityChecker connectivityChecker, FederationMetrics metrics) {
        this.cache = cache;
        this.clientFactory = clientFactory;
        this.clusterSource = clusterSource;
        this.kubeconfigResolver = kubeconfigResolver;
        this.accessReviewer = accessReviewer;
        this.groupMapper = groupMapper;
        this.connectivityChecker = connectivityChecker;
        this.metrics = metrics;
    }

    @Override
    public KubernetesClient resolve(RequestContext ctx, String clusterName, Identity identity) {
        ensureOpen();
        Identity user = groupMapper.apply(IdentityNormalizer.validate(identity));
        return resolveAs(ctx, clusterName, user);
    }

    private KubernetesClient resolveAs(RequestContext ctx, String clusterName, Identity user) {
        String cluster = ClusterNames.normalize(clusterName);
        if (ClusterNames.isLocal(cluster)) {
            return cache.getOrCreate(ctx, ClusterNames.LOCAL, user.impersonationKey(), () -> localClient(user));
        }
        ClusterNames.validate(cluster);
        return cache.getOrCreate(ctx, cluster, user.impersonationKey(), () -> remoteClient(ctx, cluster, user));
    }

    private KubernetesClient localClient(Identity user) {
        try {
            KubernetesClient client = clientFactory.localClient(user);
            metrics.recordImpersonation(FederationMetrics.CLUSTER_LOCAL, true);
            return client;
        } catch (RuntimeException e) {
            metrics.recordImpersonation(FederationMetrics.CLUSTER_LOCAL, false);
            throw e;
        }
    }

    private KubernetesClient remoteClient(RequestContext ctx, String cluster, Identity user) {
        KubernetesClient managementClient = resolveAs(ctx, ClusterNames.LOCAL, user);
        Config clusterConfig = kubeconfigResolver.resolve(ctx, managementClient, cluster);
        ctx.checkActive();
        LOG.debugf("Building client for cluster %s as %s", cluster, UserHash.of(user));
        KubernetesClient client;
        try {
            client = clientFactory.remoteClient(cluster, clusterConfig, user);
        } catch (RuntimeException e) {
            metrics.recordImpersonation(FederationMetrics.CLUSTER_REMOTE, false);
            throw e;
        }
        try {
            connectivityChecker.check(ctx, cluster, client);
        } catch (RuntimeException e) {
            client.close();
            metrics.recordImpersonation(FederationMetrics.CLUSTER_REMOTE, false);
            throw e;
        }
        metrics.recordImpersonation(FederationMetrics.CLUSTER_REMOTE, true);
        return client;
    }

    @Override
    public List<ClusterSummary> listClusters(RequestContext ctx, Identity identity) {
        KubernetesClient managementClient = resolve(ctx, ClusterNames.LOCAL, identity);
        ctx.checkActive();
        List<ClusterSummary> clusters = clusterSource.list(managementClient);
        LOG.debugf("Discovered %d clusters for %s", clusters.size(), UserHash.of(identity));
        return clusters;
    }

    @Override
    public ClusterSummary getClusterSummary(RequestContext ctx, String clusterName, Identity identity) {
        ClusterNames.validate(clusterName);
        return listClusters(ctx, identity).stream()
                .filter(cluster -> clusterName.equals(cluster.name()))
                .findFirst()
                .orElseThrow(() -> new ClusterNotFoundException(clusterName,
                        "no CAPI Cluster resource found with this name"));
    }

    @Override
    public AccessCheckResult checkAccess(RequestContext ctx, String clusterName, Identity identity,
            AccessCheck check) {
        AccessChecks.validate(check);
        String clusterType = FederationMetrics.clusterType(ClusterNames.isLocal(ClusterNames.normalize(clusterName)));
        AccessCheckResult result;
        try {
            KubernetesClient client = resolve(ctx, clusterName, identity);
            ctx.checkActive();
            result = accessReviewer.review(client, clusterName, check);
        } catch (RuntimeException e) {
            metrics.recordAccessCheck(clusterType, "error");
            throw e;
        }
        metrics.recordAccessCheck(clusterType, result.allowed() ? "allowed" : "denied");
        LOG.debugf("Access check %s %s on %s for %s: allowed=%s", check.verb(), check.resource(),
                ClusterNames.display(clusterName), UserHash.of(identity), result.allowed());
        return result;
    }

    @Override
    public CacheStats stats() {
        return cache.stats();
    }

    @Override
    public int invalidate(String clusterName) {
        return cache.invalidateCluster(ClusterNames.normalize(clusterName));
    }

    @Override
    public int evictExpired() {
        if (cache.isClosed()) {
            return 0;
        }
        return cache.evictExpired();
    }

    @Override
    public void close() {
        if (!cache.isClosed()) {
            LOG.info("Shutting down federation manager");
        }
        cache.close();
    }

    private void ensureOpen() {
        if (cache.isClosed()) {
            throw new ManagerClosedException();
        }
    }
}
