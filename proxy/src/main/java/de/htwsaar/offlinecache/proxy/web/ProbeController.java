package de.htwsaar.offlinecache.proxy.web;

import de.htwsaar.offlinecache.proxy.lifecycle.LifecycleManager;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health- und Readiness-Probes des Proxys.
 */
@RestController
@RequestMapping("/_cache")
public class ProbeController {

    private final LifecycleManager lifecycle;

    public ProbeController(LifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    /** @return HTTP 200 "ok" */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /** @return HTTP 200 "ready", solange die Version nicht aktiv ist 503 mit dem Zustand */
    @GetMapping("/ready")
    public ResponseEntity<String> ready() {
        if (lifecycle.isActive()) {
            return ResponseEntity.ok("ready");
        }
        return ResponseEntity.status(503).body(lifecycle.state().name().toLowerCase(Locale.ROOT));
    }
}
