package de.htwsaar.offlinecache.proxy.eviction;

import java.util.List;

/**
 * Ergebnis eines Cleanups.
 *
 * @param purgedPartitions gelöschte dynamische Partitionen
 * @param prunedImageEntries entfernte Bild-Einträge
 * @param remainingImageEntries verbleibende Bild-Einträge
 */
public record EvictionReport(List<String> purgedPartitions, int prunedImageEntries, int remainingImageEntries) {

    public EvictionReport {
        purgedPartitions = List.copyOf(purgedPartitions);
    }
}
