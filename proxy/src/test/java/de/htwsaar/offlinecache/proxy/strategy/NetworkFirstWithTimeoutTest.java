package de.htwsaar.offlinecache.proxy.strategy;

import static de.htwsaar.offlinecache.proxy.support.FakeUpstreamClient.ok;
import static de.htwsaar.offlinecache.proxy.support.FakeUpstreamClient.status;
import static de.htwsaar.offlinecache.proxy.support.TestRequests.body;
import static de.htwsaar.offlinecache.proxy.support.TestRequests.get;
import static de.htwsaar.offlinecache.proxy.support.TestRequests.navigation;
import static de.htwsaar.offlinecache.proxy.support.TestRequests.url;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import de.htwsaar.offlinecache.proxy.cache.CacheQuotaExceededException;
import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.InMemoryCacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.domain.CacheDecision;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.UpstreamException;
import de.htwsaar.offlinecache.proxy.support.FakeUpstreamClient;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NetworkFirstWithTimeoutTest {

    private static final Duration TIMEOUT = Duration.ofMillis(150);

    private final PartitionRegistry registry = new PartitionRegistry("v1");
    private final PartitionName api = registry.current(CacheFamily.API);
    private final PartitionName dynamic = registry.current(CacheFamily.DYNAMIC);
    private final PartitionName shell = registry.current(CacheFamily.APP_SHELL);

    private InMemoryCacheStore store;
    private FakeUpstreamClient upstream;
    private NetworkFirstWithTimeout strategy;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        upstream = new FakeUpstreamClient();
        strategy = new NetworkFirstWithTimeout(
                store, upstream, new OfflineFallback(store, registry, url("/offline.html")));
    }

    @Test
    void okResponse_isStoredAndServedByteIdenticalWhenOffline() {
        upstream.respond(url("/api/dogs"), ok("[{\"id\":1}]"));

        InterceptResult online = strategy.handle(get("/api/dogs"), api, apiConfig()).join();
        upstream.goOffline();
        InterceptResult offline = strategy.handle(get("/api/dogs"), api, apiConfig()).join();

        assertEquals(CacheDecision.MISS, online.decision());
        assertEquals(CacheDecision.HIT, offline.decision());
        assertArrayEquals(online.response().body(), offline.response().body());
    }

    @Test
    void timeout_servesCachedEntryWithinBoundAndCancelsNetworkCall() throws Exception {
        store.put(api, get("/api/dogs"), ok("cached"));
        upstream.stall(url("/api/dogs"));

        long start = System.nanoTime();
        InterceptResult result =
                strategy.handle(get("/api/dogs"), api, apiConfig()).get(2, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(CacheDecision.HIT, result.decision());
        assertEquals("cached", body(result.response()));
        assertTrue(elapsedMs >= TIMEOUT.toMillis() - 20, "Timer muss abgewartet werden: " + elapsedMs);
        assertTrue(elapsedMs < 1500, "Antwort muss kurz nach dem Timeout kommen: " + elapsedMs);
        CompletableFuture<?> loser = upstream.stalledFutures().get(0);
        assertTrue(loser.isCancelled(), "Verlierer des Rennens muss abgebrochen sein");
    }

    @Test
    void lateResponse_isNeitherReturnedNorStored() throws Exception {
        upstream.respondAfter(url("/api/slow"), ok("late"), 500);

        CompletionException ex = assertThrows(
                CompletionException.class,
                () -> strategy.handle(get("/api/slow"), api, apiConfig()).join());
        Thread.sleep(700);

        assertEquals(504, ((UpstreamException) ex.getCause()).getStatusCode());
        assertTrue(store.match(api, get("/api/slow")).isEmpty());
    }

    @Test
    void nonOkResponse_isReturnedUntouchedButNotStored() {
        upstream.respond(url("/api/missing"), status(404, "not found"));

        InterceptResult result = strategy.handle(get("/api/missing"), api, apiConfig()).join();

        assertEquals(404, result.response().statusCode());
        assertEquals("not found", body(result.response()));
        assertTrue(store.match(api, get("/api/missing")).isEmpty());
    }

    @Test
    void networkError_withoutCache_failsWith502ForApi() {
        upstream.fail(url("/api/dogs"));

        CompletionException ex = assertThrows(
                CompletionException.class,
                () -> strategy.handle(get("/api/dogs"), api, apiConfig()).join());

        assertEquals(502, ((UpstreamException) ex.getCause()).getStatusCode());
    }

    @Test
    void navigation_withoutAnyCopy_getsSynthetic503() {
        upstream.fail(url("/dogs/rex"));

        InterceptResult result = strategy.handle(navigation("/dogs/rex"), dynamic, navigationConfig()).join();

        assertEquals(CacheDecision.FALLBACK, result.decision());
        assertEquals(503, result.response().statusCode());
        assertEquals(OfflineFallback.OFFLINE_MESSAGE, body(result.response()));
        assertTrue(result.response().header("Content-Type").startsWith("text/plain"));
    }

    @Test
    void navigation_withoutCache_getsPrecachedOfflinePage() {
        store.put(shell, get("/offline.html"), ok("<h1>offline</h1>"));
        upstream.fail(url("/dogs/rex"));

        InterceptResult result = strategy.handle(navigation("/dogs/rex"), dynamic, navigationConfig()).join();

        assertEquals(CacheDecision.FALLBACK, result.decision());
        assertEquals("<h1>offline</h1>", body(result.response()));
    }

    @Test
    void navigation_prefersPrecachedShellPageOverOfflinePage() {
        store.put(shell, get("/dogs"), ok("<h1>dogs shell</h1>"));
        store.put(shell, get("/offline.html"), ok("<h1>offline</h1>"));
        upstream.fail(url("/dogs"));

        InterceptResult result = strategy.handle(navigation("/dogs"), dynamic, navigationConfig()).join();

        assertEquals(CacheDecision.HIT, result.decision());
        assertEquals("<h1>dogs shell</h1>", body(result.response()));
    }

    @Test
    void storeFailure_doesNotFailTheResponse() {
        CacheStore failing = mock(CacheStore.class);
        when(failing.put(any(), any(), any())).thenThrow(new CacheQuotaExceededException(100, 10));
        NetworkFirstWithTimeout withFailingStore = new NetworkFirstWithTimeout(
                failing, upstream, new OfflineFallback(failing, registry, null));
        upstream.respond(url("/api/dogs"), ok("fresh"));

        InterceptResult result = withFailingStore.handle(get("/api/dogs"), api, apiConfig()).join();

        assertEquals(CacheDecision.MISS, result.decision());
        assertEquals("fresh", body(result.response()));
    }

    private static StrategyConfig apiConfig() {
        return StrategyConfig.networkFirst(CacheFamily.API, TIMEOUT, false);
    }

    private static StrategyConfig navigationConfig() {
        return StrategyConfig.networkFirst(CacheFamily.DYNAMIC, TIMEOUT, true);
    }
}
