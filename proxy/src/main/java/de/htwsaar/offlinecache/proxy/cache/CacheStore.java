package de.htwsaar.offlinecache.proxy.cache;

import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Abstraktion des partitionierten Response-Stores.
 *
 * <p>Einzelne put/match/delete-Operationen sind atomar pro Schlüssel; bei gleichzeitigen Writes auf
 * denselben Schlüssel gewinnt der letzte.</p>
 */
public interface CacheStore {

    /**
     * Legt eine Partition an, falls sie noch nicht existiert.
     *
     * @param partition Partition
     */
    void open(PartitionName partition);

    /**
     * Speichert eine Antwort. Nicht-GET-Requests und Nicht-2xx-Antworten werden nie gespeichert.
     *
     * @param partition Ziel-Partition (wird bei Bedarf angelegt)
     * @param request Request, der den Schlüssel bildet
     * @param response zu speichernde Antwort
     * @return {@code true}, wenn gespeichert wurde
     * @throws CacheStorageException bei Speicherfehlern, z. B. überschrittenem Kontingent
     */
    boolean put(PartitionName partition, InterceptedRequest request, UpstreamResponse response);

    /**
     * Sucht eine gespeicherte Antwort inklusive Vary-Abgleich.
     *
     * @param partition Partition
     * @param request Request
     * @return gespeicherte Antwort oder leer
     */
    Optional<UpstreamResponse> match(PartitionName partition, InterceptedRequest request);

    /**
     * Entfernt einen Eintrag.
     *
     * @param partition Partition
     * @param key Schlüssel
     * @return {@code true}, wenn ein Eintrag entfernt wurde
     */
    boolean delete(PartitionName partition, CacheKey key);

    /**
     * @param partition Partition
     * @return Schlüssel aufsteigend nach Schreibreihenfolge
     */
    List<CacheKey> keys(PartitionName partition);

    /**
     * @param partition Partition
     * @return Anzahl Einträge (0 für unbekannte Partitionen)
     */
    int size(PartitionName partition);

    /** @return alle existierenden Partitionen */
    Set<PartitionName> partitions();

    /**
     * Löscht eine Partition samt Inhalt.
     *
     * @param partition Partition
     * @return {@code true}, wenn sie existierte
     */
    boolean deletePartition(PartitionName partition);
}
