package de.htwsaar.offlinecache.proxy.cache;

/**
 * Fehler beim Schreiben in den Cache-Store.
 */
public class CacheStorageException extends RuntimeException {

    public CacheStorageException(String message) {
        super(message);
    }

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
