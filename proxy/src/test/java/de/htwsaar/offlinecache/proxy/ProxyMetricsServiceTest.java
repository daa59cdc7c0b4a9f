package de.htwsaar.offlinecache.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import de.htwsaar.offlinecache.proxy.domain.CacheDecision;
import de.htwsaar.offlinecache.proxy.domain.Classification;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

/** Tests für die Proxy-Metriken (Entscheidungen, Fehler und Requests pro Zeitfenster). */
class ProxyMetricsServiceTest {

    @Test
    void shouldTrackDecisionsAndExactRequestsPerWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ProxyMetricsService service = new ProxyMetricsService(clock);

        service.recordResult(CacheDecision.MISS, Classification.API);
        clock.plusSeconds(5);
        service.recordResult(CacheDecision.HIT, Classification.API);
        clock.plusSeconds(5);
        service.recordResult(CacheDecision.HIT, Classification.IMAGE);
        service.recordResult(CacheDecision.FALLBACK, Classification.HTML_NAVIGATION);

        ProxyMetricsService.ProxyStatsSnapshot first = service.snapshot(60, 7);
        assertEquals(4, first.totalRequests());
        assertEquals(4, first.requestsPerWindow());
        assertEquals(2, first.cacheHits());
        assertEquals(1, first.cacheMisses());
        assertEquals(1, first.fallbacks());
        assertEquals(2.0 / 3.0, first.cacheHitRatio(), 1e-9);
        assertEquals(7, first.entriesCached());
        assertEquals(2L, first.byClassification().get("API"));
        assertEquals(1L, first.byClassification().get("IMAGE"));
        assertEquals(0L, first.byClassification().get("DYNAMIC"));

        clock.plusSeconds(61);
        ProxyMetricsService.ProxyStatsSnapshot second = service.snapshot(60, 2);
        assertEquals(4, second.totalRequests());
        assertEquals(0, second.requestsPerWindow());
        assertEquals(2, second.entriesCached());
    }

    @Test
    void shouldCountBypassFailuresAndDetachedFailuresSeparately() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ProxyMetricsService service = new ProxyMetricsService(clock);

        service.recordResult(CacheDecision.BYPASS, null);
        service.recordFailure();
        service.recordDetachedFailure();
        service.recordDetachedFailure();

        ProxyMetricsService.ProxyStatsSnapshot snapshot = service.snapshot(0, -3);
        assertEquals(2, snapshot.totalRequests());
        assertEquals(1, snapshot.bypassed());
        assertEquals(1, snapshot.failedRequests());
        assertEquals(2, snapshot.detachedTaskFailures());
        assertEquals(0.0, snapshot.cacheHitRatio());
        assertEquals(0, snapshot.entriesCached());
    }

    @Test
    void timestampsOutsideMaximumWindow_areDroppedWithoutPolling() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ProxyMetricsService service = new ProxyMetricsService(clock);

        for (int i = 0; i < 1_000; i++) {
            service.recordResult(CacheDecision.MISS, Classification.DYNAMIC);
        }
        clock.plusSeconds(ProxyMetricsService.MAX_WINDOW_SECONDS + 1);
        service.recordResult(CacheDecision.HIT, Classification.DYNAMIC);

        assertEquals(1, service.trackedRequests());
        assertEquals(1_001, service.snapshot(60, 0).totalRequests());
    }

    @Test
    void burstWithinWindow_isCappedAtMaximumTrackedRequests() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ProxyMetricsService service = new ProxyMetricsService(clock);

        int burst = ProxyMetricsService.MAX_TRACKED_REQUESTS + 25;
        for (int i = 0; i < burst; i++) {
            service.recordResult(CacheDecision.BYPASS, null);
        }

        assertEquals(ProxyMetricsService.MAX_TRACKED_REQUESTS, service.trackedRequests());
        ProxyMetricsService.ProxyStatsSnapshot snapshot = service.snapshot(Integer.MAX_VALUE, 0);
        assertEquals(burst, snapshot.totalRequests());
        assertEquals(ProxyMetricsService.MAX_TRACKED_REQUESTS, snapshot.requestsPerWindow());
    }

    /** Einfache verstellbare Uhr für deterministische Zeitfenster-Tests. */
    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant start) {
            this.current = start;
        }

        void plusSeconds(long seconds) {
            current = current.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }
    }
}
