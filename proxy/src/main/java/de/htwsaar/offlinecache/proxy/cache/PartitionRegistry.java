package de.htwsaar.offlinecache.proxy.cache;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registry der gültigen Partitionen je Familie.
 *
 * <p>Eine Partition ist veraltet, wenn ihre Familie bekannt ist und sie nicht zur aktuellen Version gehört.
 * Partitionen unbekannter Familien sind nie veraltet, auch wenn ihr Name ähnlich aussieht.</p>
 */
public final class PartitionRegistry {

    private final String version;
    private final Map<CacheFamily, PartitionName> current = new EnumMap<>(CacheFamily.class);

    /**
     * @param version aktuelle Versionskennung (nicht leer, ohne Leerzeichen)
     */
    public PartitionRegistry(String version) {
        Objects.requireNonNull(version, "version must not be null");
        String trimmed = version.trim();
        if (trimmed.isEmpty() || trimmed.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("version must be a non-blank token: '" + version + "'");
        }
        this.version = trimmed;
        for (CacheFamily family : CacheFamily.values()) {
            current.put(family, PartitionName.of(family, trimmed));
        }
    }

    /** @return aktuelle Versionskennung */
    public String version() {
        return version;
    }

    /**
     * @param family Familie
     * @return aktuelle Partition der Familie
     */
    public PartitionName current(CacheFamily family) {
        return current.get(family);
    }

    /** @return alle aktuellen Partitionen */
    public Set<PartitionName> currentPartitions() {
        return new LinkedHashSet<>(current.values());
    }

    /**
     * @param partition zu prüfende Partition
     * @return {@code true}, wenn die Familie bekannt ist und die Partition nicht aktuell
     */
    public boolean isObsolete(PartitionName partition) {
        return CacheFamily.fromWireName(partition.family())
                .map(family -> !current.get(family).equals(partition))
                .orElse(false);
    }
}
