package de.htwsaar.offlinecache.proxy.lifecycle;

import de.htwsaar.offlinecache.proxy.cache.CacheFamily;
import de.htwsaar.offlinecache.proxy.cache.CacheStore;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.cache.PartitionRegistry;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Install- und Activate-Phase einer Cache-Version.
 *
 * <p>Beide Phasen laufen strikt nacheinander. Eine gescheiterte Installation wird nie aktiviert,
 * kann aber erneut versucht werden.</p>
 */
public class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final CacheStore store;
    private final PartitionRegistry registry;
    private final UpstreamClient upstream;
    private final PrecacheManifest manifest;
    private final boolean skipWaiting;
    private final Duration installTimeout;
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.NEW);
    private final Object transitionLock = new Object();

    /**
     * @param store Cache-Store
     * @param registry Registry der aktuellen Version
     * @param upstream Upstream für das Vorab-Caching
     * @param manifest Vorab-Cache-Manifest
     * @param skipWaiting ob nach der Installation sofort aktiviert werden darf
     * @param installTimeout Obergrenze für das Laden des Manifests
     */
    public LifecycleManager(
            CacheStore store,
            PartitionRegistry registry,
            UpstreamClient upstream,
            PrecacheManifest manifest,
            boolean skipWaiting,
            Duration installTimeout) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.upstream = Objects.requireNonNull(upstream, "upstream must not be null");
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
        this.skipWaiting = skipWaiting;
        this.installTimeout = Objects.requireNonNull(installTimeout, "installTimeout must not be null");
    }

    /**
     * Lädt alle Manifest-Pfade und schreibt sie in die App-Shell-Partition.
     *
     * @throws InstallFailedException wenn ein Pfad fehlschlägt; es bleibt nichts gespeichert
     */
    public void install() {
        synchronized (transitionLock) {
            LifecycleState current = state.get();
            if (current == LifecycleState.INSTALLED
                    || current == LifecycleState.ACTIVATING
                    || current == LifecycleState.ACTIVE) {
                log.debug("Install skipped, version {} is already {}", registry.version(), current);
                return;
            }
            state.set(LifecycleState.INSTALLING);
            PartitionName shell = registry.current(CacheFamily.APP_SHELL);
            try {
                List<InterceptedRequest> requests = manifest.requests();
                List<UpstreamResponse> responses = fetchAll(requests);
                store.open(shell);
                for (int i = 0; i < requests.size(); i++) {
                    if (!store.put(shell, requests.get(i), responses.get(i))) {
                        throw new InstallFailedException("Pre-cache entry rejected: " + requests.get(i).url());
                    }
                }
                state.set(LifecycleState.INSTALLED);
                log.info("Installed cache version {} with {} pre-cached entries", registry.version(), requests.size());
            } catch (RuntimeException ex) {
                store.deletePartition(shell);
                state.set(LifecycleState.INSTALL_FAILED);
                if (ex instanceof InstallFailedException) {
                    throw ex;
                }
                throw new InstallFailedException("Install of version " + registry.version() + " failed", ex);
            }
        }
    }

    /**
     * Löscht alle veralteten Partitionen und aktiviert die Version.
     *
     * @return gelöschte Partitionen
     * @throws IllegalStateException wenn die Version nicht installiert ist
     */
    public Set<PartitionName> activate() {
        synchronized (transitionLock) {
            LifecycleState current = state.get();
            if (current == LifecycleState.ACTIVE) {
                return Set.of();
            }
            if (current != LifecycleState.INSTALLED) {
                throw new IllegalStateException("Cannot activate version " + registry.version() + " in state " + current);
            }
            state.set(LifecycleState.ACTIVATING);
            try {
                Set<PartitionName> deleted = new TreeSet<>(Comparator.comparing(PartitionName::name));
                for (PartitionName partition : store.partitions()) {
                    if (registry.isObsolete(partition) && store.deletePartition(partition)) {
                        deleted.add(partition);
                        log.info("Deleted obsolete cache partition {}", partition.name());
                    }
                }
                state.set(LifecycleState.ACTIVE);
                log.info("Activated cache version {}", registry.version());
                return deleted;
            } catch (RuntimeException ex) {
                state.set(LifecycleState.INSTALLED);
                throw ex;
            }
        }
    }

    /**
     * Aktiviert eine installierte, wartende Version. In jedem anderen Zustand ohne Wirkung.
     *
     * @return {@code true}, wenn aktiviert wurde
     */
    public boolean forceActivate() {
        synchronized (transitionLock) {
            if (state.get() != LifecycleState.INSTALLED) {
                log.debug("force-activate ignored in state {}", state.get());
                return false;
            }
            activate();
            return true;
        }
    }

    /** @return {@code true}, wenn nach der Installation sofort aktiviert werden soll */
    public boolean isActivationEligible() {
        return skipWaiting && state.get() == LifecycleState.INSTALLED;
    }

    public boolean isActive() {
        return state.get() == LifecycleState.ACTIVE;
    }

    public LifecycleState state() {
        return state.get();
    }

    public String version() {
        return registry.version();
    }

    private List<UpstreamResponse> fetchAll(List<InterceptedRequest> requests) {
        List<CompletableFuture<UpstreamResponse>> fetches =
                requests.stream().map(this::fetch).collect(Collectors.toList());
        try {
            CompletableFuture.allOf(fetches.toArray(new CompletableFuture<?>[0]))
                    .get(installTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            fetches.forEach(f -> f.cancel(true));
            throw new InstallFailedException("Pre-cache fetch timed out after " + installTimeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            fetches.forEach(f -> f.cancel(true));
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new InstallFailedException("Pre-cache fetch failed: " + cause, cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fetches.forEach(f -> f.cancel(true));
            throw new InstallFailedException("Install interrupted", ex);
        }

        List<UpstreamResponse> responses = fetches.stream().map(CompletableFuture::join).collect(Collectors.toList());
        for (int i = 0; i < responses.size(); i++) {
            UpstreamResponse response = responses.get(i);
            if (!response.isOk()) {
                throw new InstallFailedException(
                        "Pre-cache of " + requests.get(i).url() + " answered " + response.statusCode());
            }
        }
        return responses;
    }

    private CompletableFuture<UpstreamResponse> fetch(InterceptedRequest request) {
        try {
            return upstream.fetch(request);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }
}
