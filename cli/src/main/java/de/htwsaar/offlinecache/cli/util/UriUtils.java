package de.htwsaar.offlinecache.cli.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/**
 * URI helpers for CLI input validation and normalization.
 */
public final class UriUtils {
    private UriUtils() {}

    public static URI ensureTrailingSlash(URI uri) {
        Objects.requireNonNull(uri, "uri");
        String s = uri.toString();
        return URI.create(s.endsWith("/") ? s : s + "/");
    }

    public static String stripLeadingSlash(String path) {
        if (path == null) return "";
        String p = path.trim();
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p;
    }

    /**
     * Löst einen relativen Admin-Pfad gegen die Basis-URL des Proxys auf.
     *
     * @param base Basis-URL, z. B. {@code http://localhost:8080}
     * @param path Pfad mit oder ohne führenden Slash
     * @return absolute URI
     */
    public static URI resolve(URI base, String path) {
        return ensureTrailingSlash(base).resolve(stripLeadingSlash(path));
    }

    public static Optional<URI> parseHttpUri(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
