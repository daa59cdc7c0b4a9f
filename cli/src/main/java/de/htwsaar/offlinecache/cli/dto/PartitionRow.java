package de.htwsaar.offlinecache.cli.dto;

/**
 * Eine Zeile aus {@code GET /_cache/admin/partitions}.
 *
 * @param name    externer Partitionsname
 * @param family  Familie
 * @param version Version
 * @param entries Anzahl Einträge
 * @param current gehört zur aktiven Version
 */
public record PartitionRow(String name, String family, String version, int entries, boolean current) {}
