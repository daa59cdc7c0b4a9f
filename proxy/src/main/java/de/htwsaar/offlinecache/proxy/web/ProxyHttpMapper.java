package de.htwsaar.offlinecache.proxy.web;

import de.htwsaar.offlinecache.common.auth.AdminAuthFilter;
import de.htwsaar.offlinecache.proxy.domain.Headers;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

/**
 * Übersetzt zwischen Servlet-Welt und den Domain-Typen des Caches.
 */
final class ProxyHttpMapper {

    static final String X_CACHE = "X-Cache";

    /** Header, die nicht an den Upstream gehen oder vom Container neu gesetzt werden. */
    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of("content-length", "date", "server");

    /** Zugangsdaten der eigenen Origin, die nie an fremde Hosts gehen. */
    private static final Set<String> ORIGIN_CREDENTIALS = Set.of("cookie", "authorization");

    private ProxyHttpMapper() {}

    /**
     * @param servletRequest eingehender Request
     * @param target absolute Ziel-URL
     * @param ownOrigin ob das Ziel die eigene Origin ist; sonst entfallen Cookie und Authorization
     * @return Domain-Request ohne Hop-by-Hop- und Admin-Header
     * @throws IOException wenn der Body nicht lesbar ist
     */
    static InterceptedRequest toInterceptedRequest(HttpServletRequest servletRequest, URI target, boolean ownOrigin)
            throws IOException {
        String adminHeader = AdminAuthFilter.AUTH_HEADER.toLowerCase(Locale.ROOT);
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(servletRequest.getHeaderNames())) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (Headers.isHopByHop(lower) || lower.equals("host") || lower.equals("content-length")) {
                continue;
            }
            if (lower.equals(adminHeader) || (!ownOrigin && ORIGIN_CREDENTIALS.contains(lower))) {
                continue;
            }
            headers.put(name, Collections.list(servletRequest.getHeaders(name)));
        }
        byte[] body = "GET".equalsIgnoreCase(servletRequest.getMethod())
                        || "HEAD".equalsIgnoreCase(servletRequest.getMethod())
                ? new byte[0]
                : servletRequest.getInputStream().readAllBytes();
        return new InterceptedRequest(servletRequest.getMethod(), target, headers, body);
    }

    /**
     * @param result Ergebnis der Interception
     * @return Antwort mit unveränderten Bytes und {@code X-Cache}-Header
     */
    static ResponseEntity<byte[]> toResponseEntity(InterceptResult result) {
        UpstreamResponse response = result.response();
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach((name, values) -> {
            if (!Headers.isHopByHop(name) && !SKIPPED_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                headers.addAll(name, values);
            }
        });
        headers.set(X_CACHE, result.decision().name());
        return ResponseEntity.status(response.statusCode()).headers(headers).body(response.body());
    }
}
