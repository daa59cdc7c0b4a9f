package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Ersatzantworten für Navigationen ohne Netz und ohne Cache-Eintrag.
 */
public final class OfflineFallback {

    /** Body der synthetischen 503-Antwort. */
    public static final String OFFLINE_MESSAGE = "Offline - Please check your connection";

    private final CacheStore store;
    private final PartitionRegistry registry;
    private final URI offlinePage;

    /**
     * @param store Cache-Store
     * @param registry Partition-Registry
     * @param offlinePage absolute URL der vorab gecachten Offline-Seite oder {@code null}
     */
    public OfflineFallback(CacheStore store, PartitionRegistry registry, URI offlinePage) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.offlinePage = offlinePage;
    }

    /**
     * Sucht den Request in der App-Shell-Partition (vorab gecachte Seiten wie {@code /}).
     *
     * @param request Navigation
     * @return gecachte Shell-Seite oder leer
     */
    public Optional<UpstreamResponse> shellCopy(InterceptedRequest request) {
        return store.match(registry.current(CacheFamily.APP_SHELL), request);
    }

    /** @return Offline-Seite aus der App-Shell, sonst synthetische 503 */
    public UpstreamResponse resolve() {
        if (offlinePage != null) {
            Optional<UpstreamResponse> page =
                    store.match(registry.current(CacheFamily.APP_SHELL), InterceptedRequest.get(offlinePage));
            if (page.isPresent()) {
                return page.get();
            }
        }
        return UpstreamResponse.text(503, OFFLINE_MESSAGE);
    }
}
