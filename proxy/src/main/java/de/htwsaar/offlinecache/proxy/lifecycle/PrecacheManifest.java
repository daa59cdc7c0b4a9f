package de.htwsaar.offlinecache.proxy.lifecycle;

import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Feste Liste von Pfaden, die bei der Installation vorab gecacht werden.
 *
 * @param origin Basis-URI der eigenen Origin
 * @param paths absolute Pfade, jeweils mit führendem Slash
 */
public record PrecacheManifest(URI origin, List<String> paths) {

    /** App-Shell der Anwendung. */
    public static final List<String> DEFAULT_PATHS = List.of(
            "/",
            "/dogs",
            "/organizations",
            "/site.webmanifest",
            "/favicon.ico",
            "/android-chrome-192x192.png",
            "/android-chrome-512x512.png");

    public PrecacheManifest {
        Objects.requireNonNull(origin, "origin must not be null");
        paths = paths.stream().map(String::trim).filter(p -> !p.isEmpty()).collect(Collectors.toUnmodifiableList());
        for (String path : paths) {
            if (!path.startsWith("/") || path.startsWith("//")) {
                throw new IllegalArgumentException("manifest path must start with a single '/': " + path);
            }
        }
    }

    /** @return GET-Requests in Manifest-Reihenfolge */
    public List<InterceptedRequest> requests() {
        return paths.stream().map(path -> InterceptedRequest.get(origin.resolve(path))).collect(Collectors.toList());
    }
}
