package de.htwsaar.offlinecache.proxy.cache;

import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import java.util.Objects;

/**
 * Schlüssel eines Cache-Eintrags. Nur GET-Requests erzeugen Schlüssel.
 *
 * @param method immer {@code GET}
 * @param url absolute URL ohne Fragment
 */
public record CacheKey(String method, String url) {

    public CacheKey {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (!"GET".equals(method)) {
            throw new IllegalArgumentException("Only GET requests produce cache keys, got " + method);
        }
    }

    /**
     * @param request abgefangener Request
     * @return Schlüssel
     * @throws IllegalArgumentException wenn der Request kein GET ist
     */
    public static CacheKey of(InterceptedRequest request) {
        String url = request.url().toString();
        int fragment = url.indexOf('#');
        return new CacheKey(request.method(), fragment >= 0 ? url.substring(0, fragment) : url);
    }
}
