package de.htwsaar.offlinecache.proxy.config;

import java.time.Duration;

/**
 * Laufzeit-Konfiguration des Caches, live änderbar ohne Neustart.
 *
 * @param apiTimeoutMs        Netzwerk-Timeout für API-Requests in ms
 * @param navigationTimeoutMs Netzwerk-Timeout für HTML-Navigationen in ms
 * @param imageMaxEntries     maximale Einträge der Bild-Partition nach einem Cleanup
 */
public record CacheRuntimeConfig(long apiTimeoutMs, long navigationTimeoutMs, int imageMaxEntries) {

    public static final long DEFAULT_API_TIMEOUT_MS = 5000;
    public static final long DEFAULT_NAVIGATION_TIMEOUT_MS = 3000;
    public static final int DEFAULT_IMAGE_MAX_ENTRIES = 50;

    public CacheRuntimeConfig {
        apiTimeoutMs = Math.max(1, apiTimeoutMs);
        navigationTimeoutMs = Math.max(1, navigationTimeoutMs);
        imageMaxEntries = Math.max(0, imageMaxEntries);
    }

    /** @return Standardwerte */
    public static CacheRuntimeConfig defaults() {
        return new CacheRuntimeConfig(DEFAULT_API_TIMEOUT_MS, DEFAULT_NAVIGATION_TIMEOUT_MS, DEFAULT_IMAGE_MAX_ENTRIES);
    }

    public Duration apiTimeout() {
        return Duration.ofMillis(apiTimeoutMs);
    }

    public Duration navigationTimeout() {
        return Duration.ofMillis(navigationTimeoutMs);
    }
}
