package de.htwsaar.offlinecache.proxy;

import de.htwsaar.offlinecache.proxy.adapter.http.HttpUpstreamClient;
import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.InMemoryCacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.classify.ClassifierRules;
import de.htwsaar.offlinecache.proxy.classify.RequestClassifier;
import de.htwsaar.offlinecache.proxy.config.CacheConfigService;
import de.htwsaar.offlinecache.proxy.config.CacheRuntimeConfig;
import de.htwsaar.offlinecache.proxy.config.UpstreamOrigin;
import de.htwsaar.offlinecache.proxy.control.ControlChannel;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.eviction.EvictionManager;
import de.htwsaar.offlinecache.proxy.lifecycle.LifecycleManager;
import de.htwsaar.offlinecache.proxy.lifecycle.PrecacheManifest;
import de.htwsaar.offlinecache.proxy.service.CacheRouter;
import de.htwsaar.offlinecache.proxy.strategy.CacheFirstWithBackgroundRefresh;
import de.htwsaar.offlinecache.proxy.strategy.DetachedTaskRunner;
import de.htwsaar.offlinecache.proxy.strategy.NetworkFirstWithTimeout;
import de.htwsaar.offlinecache.proxy.strategy.OfflineFallback;
import de.htwsaar.offlinecache.proxy.strategy.StaleWhileRevalidate;
import de.htwsaar.offlinecache.proxy.strategy.StrategyDispatcher;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung der Proxy-Komponenten.
 *
 * <p>Schichtung: Controller → Router → Strategien/Lifecycle → Store und Upstream-Port → Adapter</p>
 */
@Configuration
public class ProxyBeans {

    /**
     * Systemuhr für den gesamten Proxy-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * JDK-HTTP-Client für Upstream-Zugriffe.
     *
     * @param connectTimeoutMs Verbindungs-Timeout in ms (Standard: 2000)
     * @return HTTP/1.1-Client ohne Redirect-Verfolgung
     */
    @Bean
    public HttpClient upstreamHttpClient(@Value("${proxy.upstream.connect-timeout-ms:2000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(Math.max(1, connectTimeoutMs)))
                .build();
    }

    /**
     * @param baseUrl Basis-URL der eigenen Origin
     * @return {@link UpstreamOrigin}
     */
    @Bean
    public UpstreamOrigin upstreamOrigin(@Value("${proxy.upstream.base-url:http://localhost:3000}") String baseUrl) {
        return UpstreamOrigin.of(baseUrl);
    }

    /**
     * Adapter-Implementierung des {@link UpstreamClient}-Ports via HTTP.
     *
     * @param httpClient       JDK-HTTP-Client
     * @param requestTimeoutMs harte Obergrenze pro Request in ms (Standard: 30000)
     * @return {@link HttpUpstreamClient}
     */
    @Bean
    public UpstreamClient upstreamClient(
            HttpClient httpClient, @Value("${proxy.upstream.request-timeout-ms:30000}") long requestTimeoutMs) {
        return new HttpUpstreamClient(httpClient, Duration.ofMillis(Math.max(1, requestTimeoutMs)));
    }

    /**
     * @param version globale Cache-Version (Standard: "v1")
     * @return Registry der gültigen Partitionen
     */
    @Bean
    public PartitionRegistry partitionRegistry(@Value("${proxy.cache.version:v1}") String version) {
        return new PartitionRegistry(version);
    }

    /**
     * @param maxBytes Byte-Kontingent (Standard: 0 = unbegrenzt)
     * @return In-Memory-Store
     */
    @Bean
    public CacheStore cacheStore(@Value("${proxy.store.max-bytes:0}") long maxBytes) {
        return new InMemoryCacheStore(maxBytes);
    }

    /**
     * Initialisiert die live-änderbare Konfiguration aus den Properties.
     *
     * @param apiTimeoutMs        API-Timeout in ms (Standard: 5000)
     * @param navigationTimeoutMs Navigations-Timeout in ms (Standard: 3000)
     * @param imageMaxEntries     Bild-Kapazität nach Cleanup (Standard: 50)
     * @return initialisierter {@link CacheConfigService}
     */
    @Bean
    public CacheConfigService cacheConfigService(
            @Value("${proxy.api.timeout-ms:5000}") long apiTimeoutMs,
            @Value("${proxy.navigation.timeout-ms:3000}") long navigationTimeoutMs,
            @Value("${proxy.image.max-entries:50}") int imageMaxEntries) {
        return new CacheConfigService(new CacheRuntimeConfig(apiTimeoutMs, navigationTimeoutMs, imageMaxEntries));
    }

    /**
     * @param origin     eigene Origin
     * @param imageHosts freigegebene Bild-Hosts
     * @param apiHosts   freigegebene API-Hosts
     * @return Klassifikator
     */
    @Bean
    public RequestClassifier requestClassifier(
            UpstreamOrigin origin,
            @Value("${proxy.image-hosts:images.rescuedogs.me,flagcdn.com}") List<String> imageHosts,
            @Value("${proxy.api-hosts:api.rescuedogs.me}") List<String> apiHosts) {
        return new RequestClassifier(new ClassifierRules(
                origin.host(),
                ClassifierRules.DEFAULT_API_PREFIX,
                ClassifierRules.DEFAULT_STATIC_PREFIX,
                new HashSet<>(imageHosts),
                new HashSet<>(apiHosts)));
    }

    /**
     * Begrenzter Pool für Hintergrund-Refreshes und Steuerkommandos.
     *
     * @param threads Anzahl Worker (Standard: 4)
     * @return Executor
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService detachedTaskExecutor(@Value("${proxy.background.threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "cache-detached-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    @Bean
    public DetachedTaskRunner detachedTaskRunner(ExecutorService detachedTaskExecutor, ProxyMetricsService metrics) {
        return new DetachedTaskRunner(detachedTaskExecutor, metrics::recordDetachedFailure);
    }

    /**
     * @param offlinePage Pfad der vorab gecachten Offline-Seite (leer = nur synthetische 503)
     */
    @Bean
    public OfflineFallback offlineFallback(
            CacheStore store,
            PartitionRegistry registry,
            UpstreamOrigin origin,
            @Value("${proxy.offline-page:/offline.html}") String offlinePage) {
        URI page = offlinePage == null || offlinePage.isBlank() ? null : origin.resolve(offlinePage.trim(), null);
        return new OfflineFallback(store, registry, page);
    }

    @Bean
    public StrategyDispatcher strategyDispatcher(
            CacheStore store,
            UpstreamClient upstream,
            OfflineFallback offlineFallback,
            DetachedTaskRunner tasks,
            PartitionRegistry registry,
            CacheConfigService configService) {
        return new StrategyDispatcher(
                List.of(
                        new NetworkFirstWithTimeout(store, upstream, offlineFallback),
                        new CacheFirstWithBackgroundRefresh(store, upstream, tasks),
                        new StaleWhileRevalidate(store, upstream, tasks)),
                registry,
                configService);
    }

    /**
     * @param paths         Manifest-Pfade
     * @param skipWaiting   sofort aktivieren (Standard: true)
     * @param installTimeoutMs Obergrenze für das Vorab-Caching in ms (Standard: 30000)
     */
    @Bean
    public LifecycleManager lifecycleManager(
            CacheStore store,
            PartitionRegistry registry,
            UpstreamClient upstream,
            UpstreamOrigin origin,
            @Value("${proxy.precache.manifest:/,/dogs,/organizations,/site.webmanifest,/favicon.ico,"
                            + "/android-chrome-192x192.png,/android-chrome-512x512.png}")
                    List<String> paths,
            @Value("${proxy.lifecycle.skip-waiting:true}") boolean skipWaiting,
            @Value("${proxy.install.timeout-ms:30000}") long installTimeoutMs) {
        return new LifecycleManager(
                store,
                registry,
                upstream,
                new PrecacheManifest(origin.baseUri(), paths),
                skipWaiting,
                Duration.ofMillis(Math.max(1, installTimeoutMs)));
    }

    @Bean
    public EvictionManager evictionManager(
            CacheStore store, PartitionRegistry registry, CacheConfigService configService) {
        return new EvictionManager(store, registry, configService);
    }

    @Bean
    public ControlChannel controlChannel(
            LifecycleManager lifecycle, EvictionManager eviction, DetachedTaskRunner tasks) {
        return new ControlChannel(lifecycle, eviction, tasks);
    }

    @Bean
    public CacheRouter cacheRouter(
            RequestClassifier classifier,
            StrategyDispatcher dispatcher,
            LifecycleManager lifecycle,
            ControlChannel controlChannel,
            UpstreamClient upstream,
            ProxyMetricsService metrics) {
        return new CacheRouter(classifier, dispatcher, lifecycle, controlChannel, upstream, metrics);
    }
}
