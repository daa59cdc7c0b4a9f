package de.htwsaar.offlinecache.proxy.web;

import de.htwsaar.offlinecache.proxy.ProxyMetricsService;
import de.htwsaar.offlinecache.proxy.ProxyMetricsService.ProxyStatsSnapshot;
import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-Endpunkt für Laufzeitmetriken.
 */
@RestController
@RequestMapping("/_cache/admin")
public class AdminStatsController {

    private final ProxyMetricsService metricsService;
    private final CacheStore store;

    public AdminStatsController(ProxyMetricsService metricsService, CacheStore store) {
        this.metricsService = metricsService;
        this.store = store;
    }

    /**
     * @param windowSec Zeitfenster in Sekunden (Standard 60)
     * @return Metrik-Snapshot
     */
    @GetMapping("/stats")
    public ResponseEntity<ProxyStatsSnapshot> stats(
            @RequestParam(name = "windowSec", defaultValue = "60") int windowSec) {
        long entries = store.partitions().stream().mapToLong(store::size).sum();
        return ResponseEntity.ok(metricsService.snapshot(windowSec, entries));
    }
}
