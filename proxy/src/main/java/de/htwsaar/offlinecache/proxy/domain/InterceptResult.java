package de.htwsaar.offlinecache.proxy.domain;

import java.util.Objects;

/**
 * Ergebnis einer Interception.
 *
 * @param response ausgelieferte Antwort
 * @param decision Herkunft der Antwort
 * @param classification Kategorie des Requests, {@code null} bei Pass-Through
 */
public record InterceptResult(UpstreamResponse response, CacheDecision decision, Classification classification) {

    public InterceptResult {
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
    }

    public static InterceptResult hit(UpstreamResponse response) {
        return new InterceptResult(response, CacheDecision.HIT, null);
    }

    public static InterceptResult miss(UpstreamResponse response) {
        return new InterceptResult(response, CacheDecision.MISS, null);
    }

    public static InterceptResult fallback(UpstreamResponse response) {
        return new InterceptResult(response, CacheDecision.FALLBACK, null);
    }

    public static InterceptResult bypass(UpstreamResponse response) {
        return new InterceptResult(response, CacheDecision.BYPASS, null);
    }

    /**
     * @param next Kategorie des Requests
     * @return Kopie mit gesetzter Kategorie
     */
    public InterceptResult withClassification(Classification next) {
        return new InterceptResult(response, decision, next);
    }
}
