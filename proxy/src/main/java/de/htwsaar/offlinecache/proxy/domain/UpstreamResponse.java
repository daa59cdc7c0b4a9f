package de.htwsaar.offlinecache.proxy.domain;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Antwort des Upstream-Servers oder aus dem Cache.
 *
 * <p>Der Body bleibt opak; die Klasse interpretiert keine Inhalte.</p>
 *
 * @param statusCode HTTP-Statuscode
 * @param headers case-insensitive Header
 * @param body Body-Bytes, nie {@code null}
 */
public record UpstreamResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public UpstreamResponse {
        headers = Headers.normalize(headers);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Erstellt eine Text-Antwort.
     *
     * @param statusCode HTTP-Status
     * @param text Body als UTF-8
     * @return Antwort mit {@code Content-Type: text/plain}
     */
    public static UpstreamResponse text(int statusCode, String text) {
        return new UpstreamResponse(
                statusCode,
                Map.of("Content-Type", List.of("text/plain; charset=utf-8")),
                text.getBytes(StandardCharsets.UTF_8));
    }

    /** @return {@code true} für Status 200-299 */
    public boolean isOk() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * @param name Header-Name
     * @return erster Header-Wert oder {@code null}
     */
    public String header(String name) {
        return Headers.first(headers, name);
    }
}
