package de.htwsaar.offlinecache.proxy.strategy;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import de.htwsaar.offlinecache.proxy.cache.InMemoryCacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.config.CacheConfigService;
import de.htwsaar.offlinecache.proxy.config.CacheRuntimeConfig;
import de.htwsaar.offlinecache.proxy.domain.Classification;
import de.htwsaar.offlinecache.proxy.support.FakeUpstreamClient;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StrategyDispatcherTest {

    private final PartitionRegistry registry = new PartitionRegistry("v3");
    private CacheConfigService configService;
    private StrategyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        FakeUpstreamClient upstream = new FakeUpstreamClient();
        DetachedTaskRunner tasks = new DetachedTaskRunner(Runnable::run, () -> {});
        configService = new CacheConfigService(CacheRuntimeConfig.defaults());
        dispatcher = new StrategyDispatcher(
                List.of(
                        new NetworkFirstWithTimeout(store, upstream, new OfflineFallback(store, registry, null)),
                        new CacheFirstWithBackgroundRefresh(store, upstream, tasks),
                        new StaleWhileRevalidate(store, upstream, tasks)),
                registry,
                configService);
    }

    @Test
    void api_usesNetworkFirstWithFiveSecondsInApiPartition() {
        Route route = dispatcher.dispatch(Classification.API);

        assertEquals(StrategyKind.NETWORK_FIRST, route.strategy().kind());
        assertEquals("api-v3", route.partition().name());
        assertEquals(Duration.ofMillis(5000), route.config().timeout());
        assertFalse(route.config().offlineFallback());
    }

    @Test
    void navigation_usesNetworkFirstWithThreeSecondsAndOfflineFallback() {
        Route route = dispatcher.dispatch(Classification.HTML_NAVIGATION);

        assertEquals(StrategyKind.NETWORK_FIRST, route.strategy().kind());
        assertEquals("dynamic-v3", route.partition().name());
        assertEquals(Duration.ofMillis(3000), route.config().timeout());
        assertTrue(route.config().offlineFallback());
    }

    @Test
    void imagesAndStaticAssets_useCacheFirst() {
        assertEquals(StrategyKind.CACHE_FIRST, dispatcher.dispatch(Classification.IMAGE).strategy().kind());
        assertEquals("image-v3", dispatcher.dispatch(Classification.IMAGE).partition().name());
        assertEquals(StrategyKind.CACHE_FIRST, dispatcher.dispatch(Classification.STATIC_ASSET).strategy().kind());
        assertEquals("app-shell-v3", dispatcher.dispatch(Classification.STATIC_ASSET).partition().name());
    }

    @Test
    void dynamic_usesStaleWhileRevalidate() {
        Route route = dispatcher.dispatch(Classification.DYNAMIC);

        assertEquals(StrategyKind.STALE_WHILE_REVALIDATE, route.strategy().kind());
        assertEquals(CacheFamily.DYNAMIC, route.config().family());
    }

    @Test
    void patchedTimeouts_applyToNextDispatch() {
        configService.patch(1200L, null, null);

        assertEquals(Duration.ofMillis(1200), dispatcher.dispatch(Classification.API).config().timeout());
        assertEquals(Duration.ofMillis(3000), dispatcher.dispatch(Classification.HTML_NAVIGATION).config().timeout());
    }

    @Test
    void missingStrategy_isRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new StrategyDispatcher(List.of(), registry, configService));
    }
}
