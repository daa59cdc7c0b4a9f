package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Liefert einen vorhandenen Eintrag sofort und aktualisiert ihn mit dem parallel gestarteten Fetch.
 *
 * <p>Ohne Eintrag wird auf den Fetch gewartet. Scheitert er, wird der Cache noch einmal geprüft,
 * weil ein gleichzeitiger Request ihn inzwischen gefüllt haben kann.</p>
 */
public final class StaleWhileRevalidate extends AbstractCachingStrategy {

    private final DetachedTaskRunner tasks;

    public StaleWhileRevalidate(CacheStore store, UpstreamClient upstream, DetachedTaskRunner tasks) {
        super(store, upstream);
        this.tasks = Objects.requireNonNull(tasks, "tasks must not be null");
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.STALE_WHILE_REVALIDATE;
    }

    @Override
    public CompletableFuture<InterceptResult> handle(
            InterceptedRequest request, PartitionName partition, StrategyConfig config) {
        CompletableFuture<UpstreamResponse> revalidation = fetch(request).thenApply(response -> {
            storeQuietly(partition, request, response);
            return response;
        });

        Optional<UpstreamResponse> cached = lookup(partition, request);
        if (cached.isPresent()) {
            tasks.observe("revalidate " + request.url(), revalidation);
            return CompletableFuture.completedFuture(InterceptResult.hit(cached.get()));
        }

        return revalidation.handle((response, error) -> {
            if (error == null) {
                return InterceptResult.miss(response);
            }
            Optional<UpstreamResponse> again = lookup(partition, request);
            if (again.isPresent()) {
                return InterceptResult.hit(again.get());
            }
            throw asUpstreamFailure(request, error);
        });
    }
}
