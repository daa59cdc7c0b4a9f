package de.htwsaar.offlinecache.proxy.cache;

/**
 * Das Byte-Kontingent des Stores würde überschritten. Es wird nichts automatisch verdrängt.
 */
public class CacheQuotaExceededException extends CacheStorageException {

    private final long requiredBytes;
    private final long maxBytes;

    public CacheQuotaExceededException(long requiredBytes, long maxBytes) {
        super("Cache quota exceeded: " + requiredBytes + " bytes needed, limit is " + maxBytes);
        this.requiredBytes = requiredBytes;
        this.maxBytes = maxBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
