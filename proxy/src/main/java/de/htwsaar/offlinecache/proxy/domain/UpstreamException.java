package de.htwsaar.offlinecache.proxy.domain;

import java.net.URI;
import java.time.Duration;

/**
 * Fachliche Exception für Upstream-Probleme ohne Cache-Ersatz.
 * Wird im Web-Layer in HTTP-Statuscodes gemappt.
 */
public class UpstreamException extends RuntimeException {

    private final int statusCode;

    /**
     * Erstellt eine neue Upstream-Exception.
     *
     * @param message    Fehlerbeschreibung
     * @param statusCode gewünschter HTTP-Statuscode (z. B. 502)
     */
    public UpstreamException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Erstellt eine neue Upstream-Exception mit Ursache.
     *
     * @param message    Fehlerbeschreibung
     * @param statusCode gewünschter HTTP-Statuscode
     * @param cause      ursprünglicher Fehler
     */
    public UpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** Upstream hat innerhalb des Timeouts nicht geantwortet (504). */
    public static UpstreamException timeout(URI url, Duration timeout) {
        return new UpstreamException("Upstream did not answer within " + timeout.toMillis() + " ms: " + url, 504);
    }

    /** Upstream war nicht erreichbar (502). */
    public static UpstreamException unreachable(URI url, Throwable cause) {
        return new UpstreamException("Upstream unreachable: " + url + " (" + cause + ")", 502, cause);
    }

    /**
     * Gibt den zugehörigen HTTP-Statuscode zurück.
     *
     * @return HTTP-Statuscode
     */
    public int getStatusCode() {
        return statusCode;
    }
}
