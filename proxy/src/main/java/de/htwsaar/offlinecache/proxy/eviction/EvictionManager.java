package de.htwsaar.offlinecache.proxy.eviction;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import de.htwsaar.offlinecache.proxy.cache.CacheKey;
import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.config.CacheConfigService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bereinigt den Cache auf Anforderung: dynamische Partitionen leeren, Bild-Partition kürzen.
 *
 * <p>Läuft synchron für den Aufrufer und blockiert keine parallel laufenden Strategien.</p>
 */
public class EvictionManager {

    private static final Logger log = LoggerFactory.getLogger(EvictionManager.class);

    private final CacheStore store;
    private final PartitionRegistry registry;
    private final CacheConfigService configService;

    public EvictionManager(CacheStore store, PartitionRegistry registry, CacheConfigService configService) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
    }

    /**
     * Führt den vollständigen Cleanup aus. Idempotent.
     *
     * @return Bericht
     */
    public EvictionReport cleanup() {
        List<String> purged = purgeDynamicPartitions();
        PartitionName images = registry.current(CacheFamily.IMAGE);
        int pruned = prune(images, configService.current().imageMaxEntries());
        EvictionReport report = new EvictionReport(purged, pruned, store.size(images));
        log.info(
                "Cleanup purged {} dynamic partition(s), pruned {} image entr{}",
                purged.size(),
                pruned,
                pruned == 1 ? "y" : "ies");
        return report;
    }

    /**
     * Löscht alle Partitionen der Familie {@code dynamic}, unabhängig von der Version.
     *
     * @return Namen der gelöschten Partitionen
     */
    public List<String> purgeDynamicPartitions() {
        List<String> purged = new ArrayList<>();
        store.partitions().stream()
                .filter(p -> p.belongsTo(CacheFamily.DYNAMIC))
                .sorted(Comparator.comparing(PartitionName::name))
                .forEach(p -> {
                    if (store.deletePartition(p)) {
                        purged.add(p.name());
                    }
                });
        return purged;
    }

    /**
     * Kürzt eine Partition auf die Kapazität, die ältesten Writes zuerst.
     *
     * @param partition Partition
     * @param capacity maximale Einträge
     * @return Anzahl entfernter Einträge
     */
    public int prune(PartitionName partition, int capacity) {
        List<CacheKey> keys = store.keys(partition);
        int excess = keys.size() - Math.max(0, capacity);
        int removed = 0;
        for (int i = 0; i < excess; i++) {
            if (store.delete(partition, keys.get(i))) {
                removed++;
            }
        }
        return removed;
    }
}
