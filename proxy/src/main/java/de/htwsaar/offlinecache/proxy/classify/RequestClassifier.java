package de.htwsaar.offlinecache.proxy.classify;

import de.htwsaar.offlinecache.proxy.domain.Classification;
import de.htwsaar.offlinecache.proxy.domain.Headers;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordnet einen Request genau einer {@link Classification} zu.
 *
 * <p>Die Regeln werden in fester Reihenfolge geprüft, die erste passende gewinnt.
 * Ein leeres Ergebnis bedeutet: nicht abfangen, unverändert durchreichen.</p>
 */
public final class RequestClassifier {

    private final ClassifierRules rules;

    public RequestClassifier(ClassifierRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /**
     * @param request abgefangener Request
     * @return Kategorie oder leer für Pass-Through
     */
    public Optional<Classification> classify(InterceptedRequest request) {
        if (!request.isGet()) {
            return Optional.empty();
        }
        URI url = request.url();
        if (!isInScope(url)) {
            return Optional.empty();
        }
        String host = hostOf(url);
        boolean apiHost = rules.apiHosts().contains(host);
        boolean imageHost = rules.imageHosts().contains(host);

        String path = url.getPath() == null ? "" : url.getPath();
        if (path.startsWith(rules.apiPathPrefix()) || apiHost) {
            return Optional.of(Classification.API);
        }
        if (imageHost || ClassifierRules.IMAGE_PATH.matcher(path).find()) {
            return Optional.of(Classification.IMAGE);
        }
        if (path.startsWith(rules.staticAssetPrefix())) {
            return Optional.of(Classification.STATIC_ASSET);
        }
        String accept = Headers.joined(request.headers(), "Accept");
        if (accept != null && accept.contains("text/html")) {
            return Optional.of(Classification.HTML_NAVIGATION);
        }
        return Optional.of(Classification.DYNAMIC);
    }

    /**
     * Prüft, ob eine URL überhaupt abgefangen werden darf: http(s) auf die eigene Origin oder einen
     * freigegebenen Bild- bzw. API-Host.
     *
     * @param url absolute URL
     * @return {@code true}, wenn der Host im Abfangbereich liegt
     */
    public boolean isInScope(URI url) {
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return false;
        }
        String host = hostOf(url);
        return host.equals(rules.ownHost()) || rules.apiHosts().contains(host) || rules.imageHosts().contains(host);
    }

    /**
     * @param url absolute URL
     * @return {@code true}, wenn die URL auf die eigene Origin zeigt
     */
    public boolean isOwnOrigin(URI url) {
        return hostOf(url).equals(rules.ownHost());
    }

    private static String hostOf(URI url) {
        return url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
    }
}
