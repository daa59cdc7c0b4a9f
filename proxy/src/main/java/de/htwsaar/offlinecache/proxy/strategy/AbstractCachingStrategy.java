package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.domain.UpstreamException;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gemeinsame Bausteine: Fetch, Lookup und Speichern, bei dem Cache-Fehler nie die Antwort kosten.
 */
abstract class AbstractCachingStrategy implements CachingStrategy {

    private static final Logger log = LoggerFactory.getLogger(AbstractCachingStrategy.class);

    protected final CacheStore store;
    protected final UpstreamClient upstream;

    protected AbstractCachingStrategy(CacheStore store, UpstreamClient upstream) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.upstream = Objects.requireNonNull(upstream, "upstream must not be null");
    }

    /** Startet den Upstream-Fetch; synchrone Fehler des Clients landen im Future. */
    protected CompletableFuture<UpstreamResponse> fetch(InterceptedRequest request) {
        try {
            return Objects.requireNonNull(upstream.fetch(request), "upstream returned no future");
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /** Cache-Lookup; ein Lesefehler zählt als Miss. */
    protected Optional<UpstreamResponse> lookup(PartitionName partition, InterceptedRequest request) {
        try {
            return store.match(partition, request);
        } catch (RuntimeException ex) {
            log.warn("Cache lookup failed for {} in {}: {}", request.url(), partition, ex.getMessage());
            return Optional.empty();
        }
    }

    /** Speichert nur 2xx; Fehler werden geloggt und nicht weitergereicht. */
    protected void storeQuietly(PartitionName partition, InterceptedRequest request, UpstreamResponse response) {
        if (!response.isOk()) {
            return;
        }
        try {
            store.put(partition, request, response);
        } catch (RuntimeException ex) {
            log.warn("Cache write failed for {} in {}: {}", request.url(), partition, ex.getMessage());
        }
    }

    /** Entfernt die Future-Hüllen um die eigentliche Ursache. */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** Übersetzt einen Fetch-Fehler in eine {@link UpstreamException}. */
    static UpstreamException asUpstreamFailure(InterceptedRequest request, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof UpstreamException) {
            return (UpstreamException) cause;
        }
        return UpstreamException.unreachable(request.url(), cause);
    }
}
