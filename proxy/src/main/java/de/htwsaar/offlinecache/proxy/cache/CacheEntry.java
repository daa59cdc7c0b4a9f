package de.htwsaar.offlinecache.proxy.cache;

import de.htwsaar.offlinecache.proxy.domain.Headers;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Gespeicherte Antwort inklusive Vary-Werten und Schreibreihenfolge.
 *
 * @param status HTTP-Status
 * @param headers Antwort-Header
 * @param body Body-Bytes
 * @param varyValues Request-Header-Werte, die laut {@code Vary} zum Eintrag gehören
 * @param storedAt monotone Schreibnummer des Stores
 */
public record CacheEntry(
        int status, Map<String, List<String>> headers, byte[] body, Map<String, String> varyValues, long storedAt) {

    private static final String VARY_ANY = "*";

    /** Antwort-Header, die nur dem ursprünglichen Client gehören und nie gespeichert werden. */
    private static final Set<String> PRIVATE_RESPONSE_HEADERS = Set.of("set-cookie", "set-cookie2");

    public CacheEntry {
        headers = Headers.normalize(headers);
        body = Objects.requireNonNull(body, "body must not be null");
        varyValues = Map.copyOf(varyValues);
    }

    /**
     * Erstellt einen Eintrag aus Request und Antwort. {@code Set-Cookie} wird nicht übernommen.
     *
     * @param request Request, dessen Header für Vary gemerkt werden
     * @param response zu speichernde Antwort
     * @param storedAt Schreibnummer
     * @return Eintrag
     */
    static CacheEntry capture(InterceptedRequest request, UpstreamResponse response, long storedAt) {
        Map<String, String> vary = new LinkedHashMap<>();
        String varyHeader = Headers.joined(response.headers(), "Vary");
        if (varyHeader != null) {
            for (String raw : varyHeader.split(",")) {
                String name = raw.trim().toLowerCase(Locale.ROOT);
                if (!name.isEmpty()) {
                    vary.put(name, VARY_ANY.equals(name) ? "" : valueOf(request, name));
                }
            }
        }
        Map<String, List<String>> shared = new LinkedHashMap<>();
        response.headers().forEach((name, values) -> {
            if (!PRIVATE_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                shared.put(name, values);
            }
        });
        return new CacheEntry(response.statusCode(), shared, response.body(), vary, storedAt);
    }

    /**
     * @param request eingehender Request
     * @return {@code true}, wenn alle Vary-Header übereinstimmen
     */
    public boolean matchesVary(InterceptedRequest request) {
        if (varyValues.containsKey(VARY_ANY)) {
            return false;
        }
        return varyValues.entrySet().stream().allMatch(e -> e.getValue().equals(valueOf(request, e.getKey())));
    }

    /** @return Antwort mit identischen Bytes */
    public UpstreamResponse toResponse() {
        return new UpstreamResponse(status, headers, body);
    }

    /** @return ungefähre Speichergröße (Body plus Header) in Bytes */
    public long sizeBytes() {
        long size = body.length;
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            for (String value : header.getValue()) {
                size += header.getKey().length() + value.length();
            }
        }
        return size;
    }

    private static String valueOf(InterceptedRequest request, String headerName) {
        String value = Headers.joined(request.headers(), headerName);
        return value == null ? "" : value;
    }
}
