package de.htwsaar.offlinecache.proxy.web;

import de.htwsaar.offlinecache.proxy.config.CacheConfigService;
import de.htwsaar.offlinecache.proxy.config.CacheRuntimeConfig;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-API für die Live-Konfiguration.
 *
 * <ul>
 *   <li>GET   /_cache/admin/config – aktuelle Konfiguration</li>
 *   <li>PATCH /_cache/admin/config – partielles Update</li>
 * </ul>
 */
@RestController
@RequestMapping("/_cache/admin/config")
public class AdminConfigController {

    private final CacheConfigService configService;

    /**
     * Constructor Injection.
     *
     * @param configService Live-Konfiguration
     */
    public AdminConfigController(CacheConfigService configService) {
        this.configService = configService;
    }

    /** @return aktuelle {@link CacheRuntimeConfig} */
    @GetMapping
    public ResponseEntity<CacheRuntimeConfig> getConfig() {
        return ResponseEntity.ok(configService.current());
    }

    /**
     * Partielles Config-Update (nur gesetzte Felder werden übernommen).
     *
     * @param dto partielles Konfigurations-DTO (Felder können {@code null} sein)
     * @return aktualisierte Konfiguration
     */
    @PatchMapping
    public ResponseEntity<CacheRuntimeConfig> patchConfig(@RequestBody ConfigPatchDto dto) {
        return ResponseEntity.ok(
                configService.patch(dto.apiTimeoutMs(), dto.navigationTimeoutMs(), dto.imageMaxEntries()));
    }

    /**
     * DTO für partielles Config-Update (alle Felder optional / nullable).
     *
     * @param apiTimeoutMs        neuer API-Timeout oder {@code null}
     * @param navigationTimeoutMs neuer Navigations-Timeout oder {@code null}
     * @param imageMaxEntries     neue Bild-Kapazität oder {@code null}
     */
    public record ConfigPatchDto(Long apiTimeoutMs, Long navigationTimeoutMs, Integer imageMaxEntries) {}
}
