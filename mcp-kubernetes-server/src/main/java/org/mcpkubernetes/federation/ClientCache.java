package org.mcpkubernetes.federation;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Per-(cluster, principal) client cache backed by Caffeine.
 * <p>
 * A miss installs an incomplete future; the caller that installed it builds the client on its own thread and every
 * concurrent caller for the same key waits on that future, bounded by its own request deadline. Failed constructions
 * are dropped from the cache when their future fails. Entries expire a fixed TTL after their last use, the cache is
 * bounded by {@link CacheConfig#maxEntries()}, and every client leaving the cache is closed.
 */
public final class ClientCache implements AutoCloseable, MeterBinder {

    private static final Logger LOG = Logger.getLogger(ClientCache.class);

    static final String METRICS_NAME = "cluster-clients";

    private static final long WAIT_SLICE_MILLIS = 100;

    private final CacheConfig config;
    private final AsyncCache<CacheKey, KubernetesClient> clients;
    private final AtomicBoolean closed = new AtomicBoolean();

    public ClientCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    public ClientCache(CacheConfig config, Ticker ticker) {
        this.config = config;
        this.clients = Caffeine.newBuilder()
                .expireAfterAccess(config.ttl())
                .maximumSize(config.maxEntries())
                .ticker(ticker)
                .executor(Runnable::run)
                .<CacheKey, KubernetesClient>removalListener(ClientCache::onRemoval)
                .recordStats()
                .buildAsync();
    }

    public KubernetesClient getOrCreate(RequestContext ctx, String cluster, String principal,
            Supplier<KubernetesClient> factory) {
        ensureOpen();
        ctx.checkActive();
        CacheKey key = new CacheKey(cluster, principal);

        CompletableFuture<KubernetesClient> pending = new CompletableFuture<>();
        AtomicBoolean owner = new AtomicBoolean();
        CompletableFuture<KubernetesClient> current = clients.get(key, (k, executor) -> {
            owner.set(true);
            return pending;
        });
        if (!owner.get()) {
            LOG.debugf("Client cache hit for %s", key);
            return await(ctx, key, current);
        }

        LOG.debugf("Client cache miss for %s, building client", key);
        KubernetesClient client;
        try {
            client = factory.get();
        } catch (Throwable e) {
            pending.completeExceptionally(e);
            throw e;
        }
        if (!pending.complete(client)) {
            // close() failed the future while the client was being built
            closeClient(key, client);
            throw new ManagerClosedException();
        }
        if (closed.get()) {
            clients.synchronous().invalidate(key);
            throw new ManagerClosedException();
        }
        ctx.checkActive();
        return client;
    }

    private KubernetesClient await(RequestContext ctx, CacheKey key, CompletableFuture<KubernetesClient> future) {
        while (true) {
            ctx.checkActive();
            ensureOpen();
            long slice = Math.min(WAIT_SLICE_MILLIS, Math.max(1, ctx.remaining().toMillis()));
            try {
                return future.get(slice, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.tracef("Still waiting for client construction for %s", key);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RequestAbortedException("interrupted while waiting for client " + key);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new ClusterConnectionException(key.cluster(), cause);
            }
        }
    }

    private static void onRemoval(CacheKey key, KubernetesClient client, RemovalCause cause) {
        if (client == null) {
            return;
        }
        LOG.debugf("Releasing client %s (%s)", key, cause);
        closeClient(key, client);
    }

    /**
     * Runs pending maintenance, which removes every entry whose TTL elapsed since last use.
     *
     * @return number of evicted entries
     */
    public int evictExpired() {
        long before = clients.synchronous().stats().evictionCount();
        clients.synchronous().cleanUp();
        return (int) (clients.synchronous().stats().evictionCount() - before);
    }

    public int invalidateCluster(String cluster) {
        List<CacheKey> keys = clients.asMap().keySet().stream()
                .filter(key -> key.cluster().equals(cluster))
                .toList();
        clients.synchronous().invalidateAll(keys);
        return keys.size();
    }

    public int size() {
        clients.synchronous().cleanUp();
        return (int) clients.synchronous().estimatedSize();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = clients.synchronous().stats();
        return new CacheStats(size(), stats.hitCount(), stats.missCount(), stats.evictionCount(),
                config.maxEntries(), config.ttl(), closed.get());
    }

    public Duration ttl() {
        return config.ttl();
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        CaffeineCacheMetrics.monitor(registry, clients.synchronous(), METRICS_NAME);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        clients.asMap().values().forEach(future -> future.completeExceptionally(new ManagerClosedException()));
        int count = size();
        clients.synchronous().invalidateAll();
        clients.synchronous().cleanUp();
        LOG.infof("Client cache closed, released %d clients", count);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ManagerClosedException();
        }
    }

    private static void closeClient(CacheKey key, KubernetesClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to close client %s", key);
        }
    }
}
