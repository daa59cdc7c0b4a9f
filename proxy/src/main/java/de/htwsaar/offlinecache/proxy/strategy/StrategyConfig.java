package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import java.time.Duration;
import java.util.Objects;

/**
 * Parameter einer Strategie für eine Request-Kategorie.
 *
 * @param kind Strategie
 * @param family Ziel-Familie
 * @param timeout Netzwerk-Timeout, nur bei {@link StrategyKind#NETWORK_FIRST}
 * @param offlineFallback ob bei fehlendem Cache-Eintrag die Offline-Seite geliefert wird
 */
public record StrategyConfig(StrategyKind kind, CacheFamily family, Duration timeout, boolean offlineFallback) {

    public StrategyConfig {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(family, "family must not be null");
        if (kind == StrategyKind.NETWORK_FIRST && (timeout == null || timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("network-first needs a positive timeout");
        }
    }

    public static StrategyConfig networkFirst(CacheFamily family, Duration timeout, boolean offlineFallback) {
        return new StrategyConfig(StrategyKind.NETWORK_FIRST, family, timeout, offlineFallback);
    }

    public static StrategyConfig cacheFirst(CacheFamily family) {
        return new StrategyConfig(StrategyKind.CACHE_FIRST, family, null, false);
    }

    public static StrategyConfig staleWhileRevalidate(CacheFamily family) {
        return new StrategyConfig(StrategyKind.STALE_WHILE_REVALIDATE, family, null, false);
    }
}
