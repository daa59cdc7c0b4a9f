package de.htwsaar.offlinecache.proxy.cache;

import java.util.Arrays;
import java.util.Optional;

/**
 * Die vier bekannten Partition-Familien.
 */
public enum CacheFamily {
    APP_SHELL("app-shell"),
    API("api"),
    IMAGE("image"),
    DYNAMIC("dynamic");

    private final String wireName;

    CacheFamily(String wireName) {
        this.wireName = wireName;
    }

    /** @return externer Name, z. B. {@code app-shell} */
    public String wireName() {
        return wireName;
    }

    /**
     * Sucht die Familie zu einem externen Namen.
     *
     * @param wireName externer Name
     * @return Familie oder leer, wenn unbekannt
     */
    public static Optional<CacheFamily> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(f -> f.wireName.equals(wireName)).findFirst();
    }
}
