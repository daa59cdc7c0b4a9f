package de.htwsaar.offlinecache.proxy.domain;

/**
 * Request-Kategorie, die über die Caching-Strategie entscheidet. Wird nie persistiert.
 */
public enum Classification {
    API,
    IMAGE,
    STATIC_ASSET,
    HTML_NAVIGATION,
    DYNAMIC
}
