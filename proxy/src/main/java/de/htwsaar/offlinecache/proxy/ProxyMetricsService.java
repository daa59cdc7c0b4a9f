package de.htwsaar.offlinecache.proxy;

import de.htwsaar.offlinecache.proxy.domain.CacheDecision;
import de.htwsaar.offlinecache.proxy.domain.Classification;
import java.time.Clock;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Service;

/**
 * Erfasst Laufzeitmetriken des Proxys.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz. Das ist für lokale Entwicklung und
 * Demo-Betrieb ausreichend.
 */
@Service
public class ProxyMetricsService {

    /** Größtes abfragbares Zeitfenster; ältere Zeitstempel werden schon beim Erfassen verworfen. */
    static final int MAX_WINDOW_SECONDS = 3600;

    /** Obergrenze gemerkter Zeitstempel, auch bei sehr hoher Last innerhalb des Fensters. */
    static final int MAX_TRACKED_REQUESTS = 100_000;

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final Map<CacheDecision, AtomicLong> decisions = new EnumMap<>(CacheDecision.class);
    private final Map<Classification, AtomicLong> classifications = new EnumMap<>(Classification.class);
    private final AtomicLong failedRequests = new AtomicLong(0);
    private final AtomicLong detachedFailures = new AtomicLong(0);
    private final Deque<Long> requestTimestampsMs = new ConcurrentLinkedDeque<>();
    private final AtomicInteger trackedRequests = new AtomicInteger(0);
    private final Clock clock;

    /**
     * Erstellt den Service mit einer expliziten Uhr.
     *
     * @param clock Zeitquelle
     */
    public ProxyMetricsService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (CacheDecision decision : CacheDecision.values()) {
            decisions.put(decision, new AtomicLong(0));
        }
        for (Classification classification : Classification.values()) {
            classifications.put(classification, new AtomicLong(0));
        }
    }

    /**
     * Erfasst einen beantworteten Request.
     *
     * @param decision Herkunft der Antwort
     * @param classification Kategorie oder {@code null} bei Pass-Through
     */
    public void recordResult(CacheDecision decision, Classification classification) {
        countRequest();
        decisions.get(decision).incrementAndGet();
        if (classification != null) {
            classifications.get(classification).incrementAndGet();
        }
    }

    /** Erfasst einen Request, für den weder Netz noch Cache eine Antwort hatten. */
    public void recordFailure() {
        countRequest();
        failedRequests.incrementAndGet();
    }

    /** Erfasst einen fehlgeschlagenen Hintergrund-Task. */
    public void recordDetachedFailure() {
        detachedFailures.incrementAndGet();
    }

    /**
     * Liefert eine Momentaufnahme inklusive exakter Request-Zahl im Zeitfenster.
     *
     * @param windowSeconds Zeitfenster in Sekunden, begrenzt auf 1 bis {@value #MAX_WINDOW_SECONDS}
     * @param entriesCached aktuelle Anzahl gecachter Einträge
     * @return Snapshot
     */
    public ProxyStatsSnapshot snapshot(int windowSeconds, long entriesCached) {
        int safeWindow = Math.min(MAX_WINDOW_SECONDS, Math.max(1, windowSeconds));
        long nowMs = clock.millis();
        purgeOldRequests(nowMs, safeWindow);

        long hits = decisions.get(CacheDecision.HIT).get();
        long misses = decisions.get(CacheDecision.MISS).get();
        long totalCacheDecisions = hits + misses;
        double hitRatio = totalCacheDecisions == 0 ? 0.0 : (double) hits / totalCacheDecisions;

        Map<String, Long> byClassification = new LinkedHashMap<>();
        classifications.forEach((c, count) -> byClassification.put(c.name(), count.get()));

        return new ProxyStatsSnapshot(
                totalRequests.get(),
                Math.max(0, trackedRequests.get()),
                hits,
                misses,
                decisions.get(CacheDecision.FALLBACK).get(),
                decisions.get(CacheDecision.BYPASS).get(),
                failedRequests.get(),
                detachedFailures.get(),
                hitRatio,
                Math.max(0, entriesCached),
                byClassification);
    }

    /** @return Anzahl aktuell gemerkter Zeitstempel */
    int trackedRequests() {
        return trackedRequests.get();
    }

    private void countRequest() {
        totalRequests.incrementAndGet();
        long nowMs = clock.millis();
        requestTimestampsMs.addLast(nowMs);
        trackedRequests.incrementAndGet();
        purgeOldRequests(nowMs, MAX_WINDOW_SECONDS);
        while (trackedRequests.get() > MAX_TRACKED_REQUESTS) {
            if (!dropOldest()) {
                break;
            }
        }
    }

    private void purgeOldRequests(long nowMs, int windowSeconds) {
        long threshold = nowMs - (windowSeconds * 1000L);
        while (true) {
            Long first = requestTimestampsMs.peekFirst();
            if (first == null || first >= threshold || !dropOldest()) {
                break;
            }
        }
    }

    private boolean dropOldest() {
        if (requestTimestampsMs.pollFirst() == null) {
            return false;
        }
        trackedRequests.decrementAndGet();
        return true;
    }

    /**
     * Unveränderlicher Snapshot der Proxy-Metriken.
     *
     * @param totalRequests Gesamtanzahl Requests seit Start
     * @param requestsPerWindow exakte Anzahl Requests im Zeitfenster
     * @param cacheHits Antworten aus dem Cache
     * @param cacheMisses Antworten vom Upstream
     * @param fallbacks Offline-Ersatzantworten
     * @param bypassed nicht abgefangene Requests
     * @param failedRequests Requests ohne Antwort
     * @param detachedTaskFailures fehlgeschlagene Hintergrund-Tasks
     * @param cacheHitRatio Trefferquote zwischen 0 und 1
     * @param entriesCached aktuell gecachte Einträge
     * @param byClassification Requests je Kategorie
     */
    public record ProxyStatsSnapshot(
            long totalRequests,
            long requestsPerWindow,
            long cacheHits,
            long cacheMisses,
            long fallbacks,
            long bypassed,
            long failedRequests,
            long detachedTaskFailures,
            double cacheHitRatio,
            long entriesCached,
            Map<String, Long> byClassification) {}
}
