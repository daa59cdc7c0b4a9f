package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.config.CacheConfigService;
import de.htwsaar.offlinecache.proxy.config.CacheRuntimeConfig;
import de.htwsaar.offlinecache.proxy.domain.Classification;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Statische Zuordnung Kategorie → Strategie, Familie und Timeout.
 *
 * <ul>
 *   <li>API → Network-First (api, API-Timeout)</li>
 *   <li>HTML-Navigation → Network-First (dynamic, Navigations-Timeout, Offline-Ersatz)</li>
 *   <li>Bild → Cache-First (image)</li>
 *   <li>Static Asset → Cache-First (app-shell)</li>
 *   <li>Dynamic → Stale-While-Revalidate (dynamic)</li>
 * </ul>
 */
public final class StrategyDispatcher {

    private final Map<StrategyKind, CachingStrategy> strategies = new EnumMap<>(StrategyKind.class);
    private final PartitionRegistry registry;
    private final CacheConfigService configService;

    /**
     * @param strategies je eine Implementierung pro {@link StrategyKind}
     * @param registry Partition-Registry der aktuellen Version
     * @param configService Live-Konfiguration für Timeouts
     */
    public StrategyDispatcher(
            List<CachingStrategy> strategies, PartitionRegistry registry, CacheConfigService configService) {
        for (CachingStrategy strategy : strategies) {
            if (this.strategies.put(strategy.kind(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate strategy for " + strategy.kind());
            }
        }
        for (StrategyKind kind : StrategyKind.values()) {
            if (!this.strategies.containsKey(kind)) {
                throw new IllegalArgumentException("Missing strategy for " + kind);
            }
        }
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
    }

    /**
     * @param classification Kategorie
     * @return Parameter laut Tabelle, Timeouts aus der aktuellen Konfiguration
     */
    public StrategyConfig configFor(Classification classification) {
        CacheRuntimeConfig cfg = configService.current();
        return switch (classification) {
            case API -> StrategyConfig.networkFirst(CacheFamily.API, cfg.apiTimeout(), false);
            case HTML_NAVIGATION -> StrategyConfig.networkFirst(CacheFamily.DYNAMIC, cfg.navigationTimeout(), true);
            case IMAGE -> StrategyConfig.cacheFirst(CacheFamily.IMAGE);
            case STATIC_ASSET -> StrategyConfig.cacheFirst(CacheFamily.APP_SHELL);
            case DYNAMIC -> StrategyConfig.staleWhileRevalidate(CacheFamily.DYNAMIC);
        };
    }

    /**
     * @param classification Kategorie
     * @return ausführbare Route
     */
    public Route dispatch(Classification classification) {
        StrategyConfig config = configFor(classification);
        return new Route(
                classification, strategies.get(config.kind()), registry.current(config.family()), config);
    }
}
