package de.htwsaar.offlinecache.proxy.strategy;

/**
 * Die drei Caching-Strategien.
 */
public enum StrategyKind {
    NETWORK_FIRST,
    CACHE_FIRST,
    STALE_WHILE_REVALIDATE
}
