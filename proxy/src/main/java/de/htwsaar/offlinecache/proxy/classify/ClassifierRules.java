package de.htwsaar.offlinecache.proxy.classify;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Konfigurierbare Regeln der Request-Klassifikation.
 *
 * @param ownHost Host der eigenen Origin
 * @param apiPathPrefix Pfadpräfix für API-Requests, z. B. {@code /api/}
 * @param staticAssetPrefix Pfadpräfix für Build-Artefakte, z. B. {@code /_next/static/}
 * @param imageHosts erlaubte fremde Bild-Hosts
 * @param apiHosts erlaubte fremde API-Hosts
 */
public record ClassifierRules(
        String ownHost, String apiPathPrefix, String staticAssetPrefix, Set<String> imageHosts, Set<String> apiHosts) {

    /** Bildendungen, case-insensitiv. */
    public static final Pattern IMAGE_PATH = Pattern.compile("\\.(jpg|jpeg|png|gif|webp|svg|ico)$", Pattern.CASE_INSENSITIVE);

    public static final String DEFAULT_API_PREFIX = "/api/";
    public static final String DEFAULT_STATIC_PREFIX = "/_next/static/";
    public static final Set<String> DEFAULT_IMAGE_HOSTS = Set.of("images.rescuedogs.me", "flagcdn.com");
    public static final Set<String> DEFAULT_API_HOSTS = Set.of("api.rescuedogs.me");

    public ClassifierRules {
        Objects.requireNonNull(ownHost, "ownHost must not be null");
        ownHost = ownHost.toLowerCase(Locale.ROOT);
        apiPathPrefix = Objects.requireNonNullElse(apiPathPrefix, DEFAULT_API_PREFIX);
        staticAssetPrefix = Objects.requireNonNullElse(staticAssetPrefix, DEFAULT_STATIC_PREFIX);
        imageHosts = lowerCase(imageHosts);
        apiHosts = lowerCase(apiHosts);
    }

    /**
     * Standardregeln für die gegebene eigene Origin.
     *
     * @param ownHost Host der eigenen Origin
     * @return Regeln mit Standard-Präfixen und -Hosts
     */
    public static ClassifierRules defaults(String ownHost) {
        return new ClassifierRules(
                ownHost, DEFAULT_API_PREFIX, DEFAULT_STATIC_PREFIX, DEFAULT_IMAGE_HOSTS, DEFAULT_API_HOSTS);
    }

    private static Set<String> lowerCase(Set<String> hosts) {
        if (hosts == null) {
            return Set.of();
        }
        return hosts.stream()
                .map(String::trim)
                .filter(h -> !h.isEmpty())
                .map(h -> h.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
