package de.htwsaar.offlinecache.proxy.cache;

import static de.htwsaar.offlinecache.proxy.support.TestRequests.post;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PartitionRegistryTest {

    private final PartitionRegistry registry = new PartitionRegistry("v2");

    @Test
    void currentPartitions_useFamilyDashVersion() {
        assertEquals("app-shell-v2", registry.current(CacheFamily.APP_SHELL).name());
        assertEquals("image-v2", registry.current(CacheFamily.IMAGE).name());
        assertEquals(4, registry.currentPartitions().size());
    }

    @Test
    void knownFamilyWithOtherVersion_isObsolete() {
        assertTrue(registry.isObsolete(new PartitionName("api", "v1")));
        assertFalse(registry.isObsolete(new PartitionName("api", "v2")));
    }

    @Test
    void unrelatedFamilySharingPrefix_isNeverObsolete() {
        assertFalse(registry.isObsolete(new PartitionName("api-cache", "v1")));
        assertFalse(registry.isObsolete(new PartitionName("images", "v1")));
        assertFalse(registry.isObsolete(new PartitionName("workbox-precache", "v2")));
    }

    @Test
    void blankOrWhitespaceVersion_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionRegistry(" "));
        assertThrows(IllegalArgumentException.class, () -> new PartitionRegistry("v 1"));
    }

    @Test
    void cacheKey_rejectsNonGet() {
        assertThrows(
                IllegalArgumentException.class,
                () -> CacheKey.of(post("/api/x")));
    }
}
