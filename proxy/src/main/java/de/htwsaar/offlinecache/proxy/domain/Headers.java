package de.htwsaar.offlinecache.proxy.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Hilfsfunktionen für HTTP-Header-Maps.
 *
 * <p>Header-Namen werden case-insensitiv behandelt, die Werte bleiben in Reihenfolge erhalten.</p>
 */
public final class Headers {

    /** Hop-by-Hop-Header, die ein Proxy niemals weiterreicht. */
    public static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    private Headers() {}

    /**
     * Erstellt eine unveränderliche, case-insensitive Kopie.
     *
     * @param headers Quell-Header, darf {@code null} sein
     * @return normalisierte Header-Map
     */
    public static Map<String, List<String>> normalize(Map<String, List<String>> headers) {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name == null || name.isBlank() || values == null) {
                    return;
                }
                copy.merge(name, List.copyOf(values), (left, right) -> {
                    List<String> merged = new ArrayList<>(left);
                    merged.addAll(right);
                    return List.copyOf(merged);
                });
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Liefert den ersten Wert eines Headers.
     *
     * @param headers Header-Map
     * @param name Header-Name
     * @return erster Wert oder {@code null}
     */
    public static String first(Map<String, List<String>> headers, String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Liefert alle Werte eines Headers kommasepariert.
     *
     * @param headers Header-Map
     * @param name Header-Name
     * @return zusammengefügter Wert oder {@code null}
     */
    public static String joined(Map<String, List<String>> headers, String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : String.join(", ", values);
    }

    /**
     * Prüft, ob ein Header ein Hop-by-Hop-Header ist.
     *
     * @param name Header-Name
     * @return {@code true}, wenn der Header nicht weitergereicht werden darf
     */
    public static boolean isHopByHop(String name) {
        return name != null && HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT));
    }
}
