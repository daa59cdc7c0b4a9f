package de.htwsaar.offlinecache.proxy.domain;

import java.util.concurrent.CompletableFuture;

/**
 * Port zur Abstraktion der Transport-Schicht zum Upstream.
 * Die Caching-Logik kennt nur diesen Port, nie den HTTP-Client selbst.
 */
public interface UpstreamClient {

    /**
     * Führt den Request asynchron gegen den Upstream aus.
     *
     * <p>Das Future schlägt bei Netzwerkfehlern fehl. HTTP-Fehlerstatus sind keine Fehler,
     * sondern normale Antworten.</p>
     *
     * @param request abgefangener Request
     * @return Future mit der Upstream-Antwort; {@code cancel(true)} bricht den Transfer ab
     */
    CompletableFuture<UpstreamResponse> fetch(InterceptedRequest request);
}
