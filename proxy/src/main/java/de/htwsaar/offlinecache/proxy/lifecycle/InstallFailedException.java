package de.htwsaar.offlinecache.proxy.lifecycle;

/**
 * Vorab-Caching ist gescheitert; die Version bleibt nicht aktivierbar.
 */
public class InstallFailedException extends RuntimeException {

    public InstallFailedException(String message) {
        super(message);
    }

    public InstallFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
