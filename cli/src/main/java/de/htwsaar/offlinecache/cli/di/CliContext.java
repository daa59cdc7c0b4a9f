package de.htwsaar.offlinecache.cli.di;

import java.io.PrintWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import org.jline.terminal.Terminal;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Bündelt Terminal, Ausgabekanäle, den geteilten HTTP-Client und den Proxy, gegen den Commands ohne
 * {@code --host} laufen. Fachliche Services gehören nicht hierher, die erzeugt die {@link ContextFactory}.
 */
public final class CliContext {

    /** Standard-Proxy, wenn weder {@code --host} noch {@code OFFLINECACHE_PROXY_URL} gesetzt sind. */
    public static final URI DEFAULT_PROXY_URL = URI.create("http://localhost:8080");

    private final Terminal terminal;
    private final PrintWriter out;
    private final PrintWriter err;
    private final HttpClient httpClient;
    private final Duration defaultRequestTimeout;
    private final URI defaultProxyUrl;

    /**
     * @param terminal JLine-Terminal für interaktive Features (Prompt, Clear, History)
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param httpClient gemeinsamer HTTP-Client für Admin-Aufrufe
     * @param defaultRequestTimeout Standard-Timeout für HTTP-Requests
     * @param defaultProxyUrl Basis-URL des Proxys für Commands ohne {@code --host}
     */
    public CliContext(
            Terminal terminal,
            PrintWriter out,
            PrintWriter err,
            HttpClient httpClient,
            Duration defaultRequestTimeout,
            URI defaultProxyUrl) {
        this.terminal = Objects.requireNonNull(terminal, "terminal");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.defaultRequestTimeout = Objects.requireNonNull(defaultRequestTimeout, "defaultRequestTimeout");
        this.defaultProxyUrl = Objects.requireNonNull(defaultProxyUrl, "defaultProxyUrl");
    }

    public Terminal terminal() {
        return terminal;
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration defaultRequestTimeout() {
        return defaultRequestTimeout;
    }

    /**
     * @param override Wert von {@code --host} oder {@code null}
     * @return {@code override}, sonst der Standard-Proxy des Kontexts
     */
    public URI proxyUrl(URI override) {
        return override != null ? override : defaultProxyUrl;
    }
}
