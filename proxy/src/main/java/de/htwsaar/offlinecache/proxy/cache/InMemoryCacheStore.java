package de.htwsaar.offlinecache.proxy.cache;

import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Thread-sicherer In-Memory-Store auf Basis von {@link ConcurrentHashMap}.
 *
 * <p>Writes laufen über {@code compute} auf der Partition, damit ein gleichzeitiges
 * {@link #deletePartition(PartitionName)} keinen Eintrag in einer bereits entfernten Map zurücklässt.
 * {@code storedAt} ist ein store-weiter Zähler, der bei jedem Write neu vergeben wird.</p>
 */
public final class InMemoryCacheStore implements CacheStore {

    private final Map<PartitionName, Map<CacheKey, CacheEntry>> partitions = new ConcurrentHashMap<>();
    private final AtomicLong writeCounter = new AtomicLong();
    private final AtomicLong usedBytes = new AtomicLong();
    private final long maxBytes;

    /** Erstellt einen Store ohne Byte-Kontingent. */
    public InMemoryCacheStore() {
        this(0);
    }

    /**
     * @param maxBytes Byte-Kontingent (0 = unbegrenzt)
     */
    public InMemoryCacheStore(long maxBytes) {
        this.maxBytes = Math.max(0, maxBytes);
    }

    @Override
    public void open(PartitionName partition) {
        partitions.computeIfAbsent(partition, p -> new ConcurrentHashMap<>());
    }

    @Override
    public boolean put(PartitionName partition, InterceptedRequest request, UpstreamResponse response) {
        if (partition == null || request == null || response == null) {
            return false;
        }
        if (!request.isGet() || !response.isOk()) {
            return false;
        }
        CacheKey key = CacheKey.of(request);
        partitions.compute(partition, (p, entries) -> {
            Map<CacheKey, CacheEntry> target = entries != null ? entries : new ConcurrentHashMap<>();
            CacheEntry entry = CacheEntry.capture(request, response, writeCounter.incrementAndGet());
            CacheEntry previous = target.get(key);
            reserve(entry.sizeBytes() - (previous == null ? 0 : previous.sizeBytes()));
            target.put(key, entry);
            return target;
        });
        return true;
    }

    @Override
    public Optional<UpstreamResponse> match(PartitionName partition, InterceptedRequest request) {
        if (partition == null || request == null || !request.isGet()) {
            return Optional.empty();
        }
        Map<CacheKey, CacheEntry> entries = partitions.get(partition);
        if (entries == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(CacheKey.of(request));
        if (entry == null || !entry.matchesVary(request)) {
            return Optional.empty();
        }
        return Optional.of(entry.toResponse());
    }

    @Override
    public boolean delete(PartitionName partition, CacheKey key) {
        AtomicBoolean removed = new AtomicBoolean(false);
        partitions.computeIfPresent(partition, (p, entries) -> {
            CacheEntry entry = entries.remove(key);
            if (entry != null) {
                usedBytes.addAndGet(-entry.sizeBytes());
                removed.set(true);
            }
            return entries;
        });
        return removed.get();
    }

    @Override
    public List<CacheKey> keys(PartitionName partition) {
        Map<CacheKey, CacheEntry> entries = partitions.get(partition);
        if (entries == null) {
            return List.of();
        }
        return entries.entrySet().stream()
                .sorted(Comparator.comparingLong(e -> e.getValue().storedAt()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public int size(PartitionName partition) {
        Map<CacheKey, CacheEntry> entries = partitions.get(partition);
        return entries == null ? 0 : entries.size();
    }

    @Override
    public Set<PartitionName> partitions() {
        return Set.copyOf(partitions.keySet());
    }

    @Override
    public boolean deletePartition(PartitionName partition) {
        Map<CacheKey, CacheEntry> removed = partitions.remove(partition);
        if (removed == null) {
            return false;
        }
        long freed = removed.values().stream().mapToLong(CacheEntry::sizeBytes).sum();
        usedBytes.addAndGet(-freed);
        return true;
    }

    /** @return aktuell belegte Bytes */
    public long usedBytes() {
        return usedBytes.get();
    }

    private void reserve(long delta) {
        if (delta <= 0 || maxBytes == 0) {
            usedBytes.addAndGet(delta);
            return;
        }
        while (true) {
            long used = usedBytes.get();
            long next = used + delta;
            if (next > maxBytes) {
                throw new CacheQuotaExceededException(next, maxBytes);
            }
            if (usedBytes.compareAndSet(used, next)) {
                return;
            }
        }
    }
}
