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
 * Cache zuerst. Ein Treffer wird sofort geliefert und im Hintergrund aktualisiert.
 */
public final class CacheFirstWithBackgroundRefresh extends AbstractCachingStrategy {

    private final DetachedTaskRunner tasks;

    public CacheFirstWithBackgroundRefresh(CacheStore store, UpstreamClient upstream, DetachedTaskRunner tasks) {
        super(store, upstream);
        this.tasks = Objects.requireNonNull(tasks, "tasks must not be null");
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.CACHE_FIRST;
    }

    @Override
    public CompletableFuture<InterceptResult> handle(
            InterceptedRequest request, PartitionName partition, StrategyConfig config) {
        Optional<UpstreamResponse> cached = lookup(partition, request);
        if (cached.isPresent()) {
            tasks.spawnDetached(
                    "refresh " + request.url(),
                    () -> fetch(request).thenAccept(response -> storeQuietly(partition, request, response)));
            return CompletableFuture.completedFuture(InterceptResult.hit(cached.get()));
        }
        return fetch(request).handle((response, error) -> {
            if (error != null) {
                throw asUpstreamFailure(request, error);
            }
            storeQuietly(partition, request, response);
            return InterceptResult.miss(response);
        });
    }
}
