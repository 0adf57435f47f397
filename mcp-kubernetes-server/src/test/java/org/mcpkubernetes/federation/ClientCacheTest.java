package org.mcpkubernetes.federation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.fabric8.kubernetes.client.KubernetesClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClientCacheTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private MutableClock clock;
    private ClientCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new ClientCache(new CacheConfig(TTL, 3, Duration.ofMinutes(1)), clock::nanos);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private RequestContext ctx() {
        return RequestContext.withTimeout(Duration.ofSeconds(30));
    }

    @Test
    void secondLookupForSameKeyIsAHit() {
        KubernetesClient client = mock(KubernetesClient.class);
        AtomicInteger builds = new AtomicInteger();
        Supplier<KubernetesClient> factory = () -> {
            builds.incrementAndGet();
            return client;
        };

        KubernetesClient first = cache.getOrCreate(ctx(), "prod", "jane@example.com", factory);
        KubernetesClient second = cache.getOrCreate(ctx(), "prod", "jane@example.com", factory);

        assertThat(first).isSameAs(second).isSameAs(client);
        assertThat(builds).hasValue(1);
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(cache.stats().misses()).isEqualTo(1);
    }

    @Test
    void usersDoNotShareClients() {
        KubernetesClient jane = cache.getOrCreate(ctx(), "prod", "jane@example.com",
                () -> mock(KubernetesClient.class));
        KubernetesClient john = cache.getOrCreate(ctx(), "prod", "john@example.com",
                () -> mock(KubernetesClient.class));

        assertThat(jane).isNotSameAs(john);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void concurrentMissesBuildOnlyOnce() throws Exception {
        int callers = 16;
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger builds = new AtomicInteger();
        KubernetesClient client = mock(KubernetesClient.class);
        Supplier<KubernetesClient> slowFactory = () -> {
            builds.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return client;
        };

        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<KubernetesClient>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> cache.getOrCreate(ctx(), "prod", "jane@example.com", slowFactory)));
            }
            await().atMost(Duration.ofSeconds(5)).until(() -> builds.get() == 1);
            release.countDown();

            for (Future<KubernetesClient> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(client);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(builds).hasValue(1);
        assertThat(cache.stats().misses()).isEqualTo(1);
        assertThat(cache.stats().hits()).isEqualTo(callers - 1);
    }

    @Test
    void ttlRollsForwardOnUse() {
        KubernetesClient client = mock(KubernetesClient.class);
        cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> client);

        clock.advance(Duration.ofMinutes(9));
        cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> mock(KubernetesClient.class));
        clock.advance(Duration.ofMinutes(9));
        KubernetesClient stillCached = cache.getOrCreate(ctx(), "prod", "jane@example.com",
                () -> mock(KubernetesClient.class));

        assertThat(stillCached).isSameAs(client);
        verify(client, never()).close();
    }

    @Test
    void idleEntryExpiresAndIsClosed() {
        KubernetesClient stale = mock(KubernetesClient.class);
        cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> stale);

        clock.advance(TTL.plusSeconds(1));
        KubernetesClient fresh = cache.getOrCreate(ctx(), "prod", "jane@example.com",
                () -> mock(KubernetesClient.class));

        assertThat(fresh).isNotSameAs(stale);
        verify(stale).close();
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    void evictExpiredRemovesOnlyIdleEntries() {
        cache.getOrCreate(ctx(), "old", "jane@example.com", () -> mock(KubernetesClient.class));
        clock.advance(Duration.ofMinutes(6));
        cache.getOrCreate(ctx(), "new", "jane@example.com", () -> mock(KubernetesClient.class));
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void sizeBoundEvictsAndClosesOverflowingClients() {
        AtomicInteger closes = new AtomicInteger();
        for (String cluster : List.of("a", "b", "c", "d", "e")) {
            cache.getOrCreate(ctx(), cluster, "jane@example.com", () -> closeCounting(closes));
        }

        assertThat(cache.size()).isLessThanOrEqualTo(3);
        assertThat(closes).hasValue(5 - cache.size());
        assertThat(cache.stats().evictions()).isEqualTo(closes.get());
    }

    private static KubernetesClient closeCounting(AtomicInteger closes) {
        KubernetesClient client = mock(KubernetesClient.class);
        doAnswer(invocation -> {
            closes.incrementAndGet();
            return null;
        }).when(client).close();
        return client;
    }

    @Test
    void failedConstructionLeavesNothingBehind() {
        assertThatThrownBy(() -> cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> {
            throw new ClusterConnectionException("prod", new IllegalStateException("boom"));
        })).isInstanceOf(ClusterConnectionException.class);

        assertThat(cache.size()).isZero();
        KubernetesClient client = mock(KubernetesClient.class);
        assertThat(cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> client)).isSameAs(client);
    }

    @Test
    void factoryErrorReachesWaitersWithoutWaitingForTheirDeadline() throws Exception {
        CountDownLatch waiterQueued = new CountDownLatch(1);
        AtomicInteger builds = new AtomicInteger();
        Supplier<KubernetesClient> failingFactory = () -> {
            builds.incrementAndGet();
            try {
                waiterQueued.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new LinkageError("client classes unavailable");
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<KubernetesClient> builder = executor.submit(
                    () -> cache.getOrCreate(ctx(), "prod", "jane@example.com", failingFactory));
            await().atMost(Duration.ofSeconds(5)).until(() -> builds.get() == 1);
            RequestContext waiterCtx = RequestContext.withTimeout(Duration.ofMinutes(5));
            Future<KubernetesClient> waiter = executor.submit(
                    () -> cache.getOrCreate(waiterCtx, "prod", "jane@example.com", failingFactory));
            waiterQueued.countDown();

            assertThatThrownBy(() -> builder.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(LinkageError.class);
            assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(LinkageError.class);
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isZero();
    }

    @Test
    void closeDuringConstructionFailsWaitersAndReleasesTheLateClient() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger builds = new AtomicInteger();
        KubernetesClient late = mock(KubernetesClient.class);
        Supplier<KubernetesClient> slowFactory = () -> {
            builds.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return late;
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<KubernetesClient> builder = executor.submit(
                    () -> cache.getOrCreate(ctx(), "prod", "jane@example.com", slowFactory));
            await().atMost(Duration.ofSeconds(5)).until(() -> builds.get() == 1);
            RequestContext waiterCtx = RequestContext.withTimeout(Duration.ofMinutes(5));
            Future<KubernetesClient> waiter = executor.submit(
                    () -> cache.getOrCreate(waiterCtx, "prod", "jane@example.com", slowFactory));

            cache.close();

            assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(ManagerClosedException.class);
            release.countDown();
            assertThatThrownBy(() -> builder.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(ManagerClosedException.class);
        } finally {
            executor.shutdownNow();
        }

        verify(late).close();
        assertThat(builds).hasValue(1);
    }

    @Test
    void cancelledRequestNeverReachesTheFactory() {
        RequestContext cancelled = ctx();
        cancelled.cancel();
        AtomicInteger builds = new AtomicInteger();

        assertThatThrownBy(() -> cache.getOrCreate(cancelled, "prod", "jane@example.com", () -> {
            builds.incrementAndGet();
            return mock(KubernetesClient.class);
        })).isInstanceOf(RequestAbortedException.class);
        assertThat(builds).hasValue(0);
    }

    @Test
    void invalidateClusterDropsEveryUsersEntry() {
        cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> mock(KubernetesClient.class));
        cache.getOrCreate(ctx(), "prod", "john@example.com", () -> mock(KubernetesClient.class));
        cache.getOrCreate(ctx(), "dev", "jane@example.com", () -> mock(KubernetesClient.class));

        assertThat(cache.invalidateCluster("prod")).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void closeReleasesClientsAndRejectsNewRequests() {
        KubernetesClient client = mock(KubernetesClient.class);
        cache.getOrCreate(ctx(), "prod", "jane@example.com", () -> client);

        cache.close();
        cache.close();

        verify(client).close();
        assertThat(cache.stats().closed()).isTrue();
        assertThatThrownBy(() -> cache.getOrCreate(ctx(), "prod", "jane@example.com",
                () -> mock(KubernetesClient.class)))
                .isInstanceOf(ManagerClosedException.class);
    }
}
