package de.htwsaar.offlinecache.proxy.cache;

import java.util.Objects;

/**
 * Name einer Cache-Partition, bestehend aus Familie und Version.
 *
 * <p>Die Familie ist ein freier String, damit fremde Partitionen im Store existieren dürfen,
 * ohne dass der Lifecycle sie anfasst.</p>
 *
 * @param family Familienname
 * @param version Versionskennung
 */
public record PartitionName(String family, String version) {

    public PartitionName {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(version, "version must not be null");
        if (family.isBlank() || version.isBlank()) {
            throw new IllegalArgumentException("family and version must not be blank");
        }
    }

    /**
     * @param family bekannte Familie
     * @param version Versionskennung
     * @return Partitionsname
     */
    public static PartitionName of(CacheFamily family, String version) {
        return new PartitionName(family.wireName(), version);
    }

    /** @return externer Name {@code family-version} */
    public String name() {
        return family + "-" + version;
    }

    /**
     * @param candidate Familie
     * @return {@code true}, wenn die Partition zu dieser Familie gehört
     */
    public boolean belongsTo(CacheFamily candidate) {
        return candidate.wireName().equals(family);
    }

    @Override
    public String toString() {
        return name();
    }
}
