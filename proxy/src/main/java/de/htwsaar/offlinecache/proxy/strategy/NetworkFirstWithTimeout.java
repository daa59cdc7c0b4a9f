package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.domain.UpstreamException;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netzwerk zuerst, begrenzt durch einen Timeout; danach Cache, danach Offline-Ersatz.
 *
 * <p>Gewinnt der Timer, wird der noch laufende Upstream-Request abgebrochen. Eine verspätete Antwort
 * landet damit weder beim Client noch im Cache.</p>
 */
public final class NetworkFirstWithTimeout extends AbstractCachingStrategy {

    private static final Logger log = LoggerFactory.getLogger(NetworkFirstWithTimeout.class);

    private final OfflineFallback offlineFallback;

    public NetworkFirstWithTimeout(CacheStore store, UpstreamClient upstream, OfflineFallback offlineFallback) {
        super(store, upstream);
        this.offlineFallback = Objects.requireNonNull(offlineFallback, "offlineFallback must not be null");
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.NETWORK_FIRST;
    }

    @Override
    public CompletableFuture<InterceptResult> handle(
            InterceptedRequest request, PartitionName partition, StrategyConfig config) {
        CompletableFuture<UpstreamResponse> network = fetch(request);
        return network.copy()
                .orTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error == null) {
                        storeQuietly(partition, request, response);
                        return InterceptResult.miss(response);
                    }
                    Throwable cause = unwrap(error);
                    boolean timedOut = cause instanceof TimeoutException;
                    if (timedOut) {
                        network.cancel(true);
                        log.info("Network timeout after {} ms for {}", config.timeout().toMillis(), request.url());
                    } else {
                        log.info("Network failed for {}: {}", request.url(), cause.toString());
                    }
                    return fromCache(request, partition, config, timedOut, cause);
                });
    }

    private InterceptResult fromCache(
            InterceptedRequest request,
            PartitionName partition,
            StrategyConfig config,
            boolean timedOut,
            Throwable cause) {
        Optional<UpstreamResponse> cached = lookup(partition, request);
        if (cached.isPresent()) {
            return InterceptResult.hit(cached.get());
        }
        if (config.offlineFallback()) {
            Optional<UpstreamResponse> shell = offlineFallback.shellCopy(request);
            if (shell.isPresent()) {
                return InterceptResult.hit(shell.get());
            }
            return InterceptResult.fallback(offlineFallback.resolve());
        }
        if (timedOut) {
            throw UpstreamException.timeout(request.url(), config.timeout());
        }
        throw asUpstreamFailure(request, cause);
    }
}
