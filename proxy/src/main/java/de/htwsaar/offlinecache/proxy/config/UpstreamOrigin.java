package de.htwsaar.offlinecache.proxy.config;

import java.net.URI;
import java.util.Objects;

/**
 * Basis-URI der eigenen Origin, an die der Proxy weiterleitet.
 *
 * @param baseUri absolute Basis-URI, z. B. {@code http://localhost:3000}
 */
public record UpstreamOrigin(URI baseUri) {

    public UpstreamOrigin {
        Objects.requireNonNull(baseUri, "baseUri must not be null");
        if (!baseUri.isAbsolute() || baseUri.getHost() == null) {
            throw new IllegalArgumentException("upstream base url must be absolute: " + baseUri);
        }
    }

    public static UpstreamOrigin of(String baseUrl) {
        return new UpstreamOrigin(URI.create(baseUrl.trim()));
    }

    /** @return Host der Origin */
    public String host() {
        return baseUri.getHost();
    }

    /**
     * Baut die Ziel-URI für einen Pfad inklusive optionaler Query.
     *
     * @param rawPath roher, bereits kodierter Pfad mit führendem Slash
     * @param rawQuery rohe Query oder {@code null}
     * @return absolute Ziel-URI
     */
    public URI resolve(String rawPath, String rawQuery) {
        // führende Doppel-Slashes würden als Authority gelesen
        String path = rawPath == null || rawPath.isEmpty() ? "/" : rawPath.replaceFirst("^/+", "/");
        String target = rawQuery == null || rawQuery.isEmpty() ? path : path + "?" + rawQuery;
        return baseUri.resolve(target);
    }

    /**
     * @param target absolute URL
     * @return {@code true}, wenn Host und effektiver Port mit der Origin übereinstimmen
     */
    public boolean sameAuthority(URI target) {
        return target.getHost() != null
                && target.getHost().equalsIgnoreCase(baseUri.getHost())
                && effectivePort(target) == effectivePort(baseUri);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }
}
