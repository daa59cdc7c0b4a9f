package de.htwsaar.offlinecache.proxy.domain;

/**
 * Herkunft einer ausgelieferten Antwort.
 */
public enum CacheDecision {
    /** Aus einer Cache-Partition. */
    HIT,
    /** Vom Upstream. */
    MISS,
    /** Offline-Seite oder synthetische 503. */
    FALLBACK,
    /** Nicht abgefangen, unverändert durchgereicht. */
    BYPASS
}
