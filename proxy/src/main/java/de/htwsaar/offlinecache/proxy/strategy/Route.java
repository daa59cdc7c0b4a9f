package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.domain.Classification;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import java.util.concurrent.CompletableFuture;

/**
 * Ergebnis des Dispatch: Strategie, Ziel-Partition und Parameter für eine Kategorie.
 *
 * @param classification Kategorie
 * @param strategy gewählte Strategie
 * @param partition aktuelle Partition der Ziel-Familie
 * @param config Parameter
 */
public record Route(
        Classification classification, CachingStrategy strategy, PartitionName partition, StrategyConfig config) {

    /**
     * @param request Request
     * @return Future mit dem Ergebnis, Kategorie bereits gesetzt
     */
    public CompletableFuture<InterceptResult> execute(InterceptedRequest request) {
        return strategy.handle(request, partition, config).thenApply(result -> result.withClassification(classification));
    }
}
