package de.htwsaar.offlinecache.proxy.config;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Zentraler, thread-sicherer Runtime-Config-Store.
 *
 * <p>Dispatcher und Eviction lesen Timeouts und Kapazität bei jedem Aufruf über diesen Service,
 * dadurch greifen Änderungen sofort.</p>
 */
public class CacheConfigService {

    private final AtomicReference<CacheRuntimeConfig> ref;

    /**
     * @param initial Startkonfiguration (darf nicht {@code null} sein)
     */
    public CacheConfigService(CacheRuntimeConfig initial) {
        this.ref = new AtomicReference<>(Objects.requireNonNull(initial, "initial config must not be null"));
    }

    /** @return aktuelle {@link CacheRuntimeConfig} */
    public CacheRuntimeConfig current() {
        return ref.get();
    }

    /**
     * Partielles Update: nur nicht-{@code null}-Felder werden übernommen.
     *
     * @param apiTimeoutMs        neuer API-Timeout oder {@code null}
     * @param navigationTimeoutMs neuer Navigations-Timeout oder {@code null}
     * @param imageMaxEntries     neue Bild-Kapazität oder {@code null}
     * @return aktualisierte Konfiguration
     */
    public CacheRuntimeConfig patch(Long apiTimeoutMs, Long navigationTimeoutMs, Integer imageMaxEntries) {
        return ref.updateAndGet(cur -> new CacheRuntimeConfig(
                apiTimeoutMs != null ? apiTimeoutMs : cur.apiTimeoutMs(),
                navigationTimeoutMs != null ? navigationTimeoutMs : cur.navigationTimeoutMs(),
                imageMaxEntries != null ? imageMaxEntries : cur.imageMaxEntries()));
    }
}
