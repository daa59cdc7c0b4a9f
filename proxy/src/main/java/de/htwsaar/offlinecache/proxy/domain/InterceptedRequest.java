package de.htwsaar.offlinecache.proxy.domain;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Ein abgefangener HTTP-Request mit absoluter URL.
 *
 * @param method HTTP-Methode (großgeschrieben)
 * @param url absolute Ziel-URL
 * @param headers case-insensitive Header
 * @param body Request-Body, leer wenn nicht vorhanden
 */
public record InterceptedRequest(String method, URI url, Map<String, List<String>> headers, byte[] body) {

    public InterceptedRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (!url.isAbsolute()) {
            throw new IllegalArgumentException("url must be absolute: " + url);
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        headers = Headers.normalize(headers);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Erstellt einen GET-Request ohne Header.
     *
     * @param url absolute URL
     * @return Request
     */
    public static InterceptedRequest get(URI url) {
        return new InterceptedRequest("GET", url, Map.of(), null);
    }

    /**
     * Erstellt einen GET-Request mit einfachen Headern.
     *
     * @param url absolute URL
     * @param headers Header-Name → Wert
     * @return Request
     */
    public static InterceptedRequest get(URI url, Map<String, String> headers) {
        Map<String, List<String>> multi = new LinkedHashMap<>();
        headers.forEach((name, value) -> multi.put(name, List.of(value)));
        return new InterceptedRequest("GET", url, multi, null);
    }

    /** @return {@code true} bei GET */
    public boolean isGet() {
        return "GET".equals(method);
    }

    /**
     * @param name Header-Name
     * @return erster Header-Wert oder {@code null}
     */
    public String header(String name) {
        return Headers.first(headers, name);
    }
}
