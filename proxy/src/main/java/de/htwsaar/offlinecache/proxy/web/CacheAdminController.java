package de.htwsaar.offlinecache.proxy.web;

import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.control.ControlCommand;
import de.htwsaar.offlinecache.proxy.control.ControlMessage;
import de.htwsaar.offlinecache.proxy.lifecycle.InstallFailedException;
import de.htwsaar.offlinecache.proxy.lifecycle.LifecycleManager;
import de.htwsaar.offlinecache.proxy.service.CacheRouter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Partitionen, Steuerkommandos und Lifecycle.
 *
 * <ul>
 *   <li>GET  /_cache/admin/partitions         – Partitionen mit Eintragsanzahl</li>
 *   <li>POST /_cache/admin/commands           – Steuerkommando absetzen (202)</li>
 *   <li>GET  /_cache/admin/lifecycle          – Zustand der Version</li>
 *   <li>POST /_cache/admin/lifecycle/install  – Installation erneut versuchen</li>
 * </ul>
 */
@RestController
@RequestMapping("/_cache/admin")
public class CacheAdminController {

    private final CacheRouter router;
    private final CacheStore store;
    private final PartitionRegistry registry;

    /**
     * Constructor Injection.
     *
     * @param router   Cache-Router
     * @param store    Cache-Store
     * @param registry Partition-Registry
     */
    public CacheAdminController(CacheRouter router, CacheStore store, PartitionRegistry registry) {
        this.router = router;
        this.store = store;
        this.registry = registry;
    }

    /** @return alle Partitionen, sortiert nach Name */
    @GetMapping("/partitions")
    public ResponseEntity<List<PartitionView>> partitions() {
        List<PartitionView> views = store.partitions().stream()
                .sorted(Comparator.comparing(PartitionName::name))
                .map(p -> new PartitionView(
                        p.name(), p.family(), p.version(), store.size(p), registry.currentPartitions().contains(p)))
                .collect(Collectors.toList());
        return ResponseEntity.ok(views);
    }

    /**
     * Nimmt ein Steuerkommando an. Die Verarbeitung läuft asynchron, unbekannte Kommandos werden ignoriert.
     *
     * @param message Kommando
     * @return immer 202
     */
    @PostMapping("/commands")
    public ResponseEntity<Map<String, String>> command(@RequestBody ControlMessage message) {
        boolean known = ControlCommand.fromWire(message.action()).isPresent();
        router.onCommand(message);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of(
                        "action", String.valueOf(message.action()),
                        "status", known ? "accepted" : "ignored"));
    }

    /** @return Version und Zustand */
    @GetMapping("/lifecycle")
    public ResponseEntity<Map<String, String>> lifecycle() {
        return ResponseEntity.ok(lifecycleView(router.lifecycle()));
    }

    /**
     * Führt Install (und bei Skip-Waiting Activate) erneut aus.
     *
     * @return neuer Zustand oder 503 bei gescheiterter Installation
     */
    @PostMapping("/lifecycle/install")
    public ResponseEntity<Map<String, String>> install() {
        try {
            router.onInstall();
            return ResponseEntity.ok(lifecycleView(router.lifecycle()));
        } catch (InstallFailedException ex) {
            Map<String, String> body = lifecycleView(router.lifecycle());
            body.put("error", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }

    private static Map<String, String> lifecycleView(LifecycleManager lifecycle) {
        Map<String, String> view = new LinkedHashMap<>();
        view.put("version", lifecycle.version());
        view.put("state", lifecycle.state().name());
        return view;
    }

    /**
     * Sicht auf eine Partition.
     *
     * @param name    externer Name
     * @param family  Familie
     * @param version Version
     * @param entries Anzahl Einträge
     * @param current ob die Partition zur aktuellen Version gehört
     */
    public record PartitionView(String name, String family, String version, int entries, boolean current) {}
}
