package de.htwsaar.offlinecache.proxy.strategy;

import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import java.util.concurrent.CompletableFuture;

/**
 * Gemeinsame Schnittstelle der Caching-Strategien.
 */
public interface CachingStrategy {

    /** @return welche Strategie implementiert wird */
    StrategyKind kind();

    /**
     * Beantwortet einen Request nach dieser Strategie.
     *
     * <p>Das Future schlägt mit einer {@link de.htwsaar.offlinecache.proxy.domain.UpstreamException}
     * fehl, wenn weder Netzwerk noch Cache eine Antwort liefern.</p>
     *
     * @param request Request
     * @param partition Partition für Lookup und Speicherung
     * @param config Parameter der Kategorie
     * @return Future mit Antwort und Herkunft
     */
    CompletableFuture<InterceptResult> handle(InterceptedRequest request, PartitionName partition, StrategyConfig config);
}
