package de.htwsaar.offlinecache.proxy.lifecycle;

/**
 * Zustände einer Cache-Version.
 */
public enum LifecycleState {
    NEW,
    INSTALLING,
    INSTALLED,
    INSTALL_FAILED,
    ACTIVATING,
    ACTIVE
}
