package de.htwsaar.offlinecache.proxy.service;

import de.htwsaar.offlinecache.proxy.ProxyMetricsService;
import de.htwsaar.offlinecache.proxy.cache.PartitionName;
import de.htwsaar.offlinecache.proxy.classify.RequestClassifier;
import de.htwsaar.offlinecache.proxy.control.ControlChannel;
import de.htwsaar.offlinecache.proxy.control.ControlMessage;
import de.htwsaar.offlinecache.proxy.domain.Classification;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.domain.UpstreamException;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import de.htwsaar.offlinecache.proxy.lifecycle.LifecycleManager;
import de.htwsaar.offlinecache.proxy.strategy.StrategyDispatcher;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Einstiegspunkt der Caching-Schicht mit den vier Ereignissen Install, Activate, Intercept und Command.
 *
 * <p>Solange die Version nicht aktiv ist, wird jeder Request unverändert durchgereicht.</p>
 */
public class CacheRouter {

    private static final Logger log = LoggerFactory.getLogger(CacheRouter.class);

    private final RequestClassifier classifier;
    private final StrategyDispatcher dispatcher;
    private final LifecycleManager lifecycle;
    private final ControlChannel controlChannel;
    private final UpstreamClient upstream;
    private final ProxyMetricsService metrics;

    public CacheRouter(
            RequestClassifier classifier,
            StrategyDispatcher dispatcher,
            LifecycleManager lifecycle,
            ControlChannel controlChannel,
            UpstreamClient upstream,
            ProxyMetricsService metrics) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.controlChannel = Objects.requireNonNull(controlChannel, "controlChannel must not be null");
        this.upstream = Objects.requireNonNull(upstream, "upstream must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Installiert die Version und aktiviert sie direkt, wenn Skip-Waiting gesetzt ist.
     *
     * @throws de.htwsaar.offlinecache.proxy.lifecycle.InstallFailedException bei gescheiterter Installation
     */
    public void onInstall() {
        lifecycle.install();
        if (lifecycle.isActivationEligible()) {
            onActivate();
        }
    }

    /** @return beim Aktivieren gelöschte Partitionen */
    public Set<PartitionName> onActivate() {
        return lifecycle.activate();
    }

    /**
     * Beantwortet einen abgefangenen Request.
     *
     * @param request Request
     * @return Future mit Antwort; schlägt mit {@link UpstreamException} fehl, wenn nichts lieferbar ist
     */
    public CompletableFuture<InterceptResult> onIntercept(InterceptedRequest request) {
        Optional<Classification> classification =
                lifecycle.isActive() ? classifier.classify(request) : Optional.empty();
        CompletableFuture<InterceptResult> result = classification.isPresent()
                ? dispatcher.dispatch(classification.get()).execute(request)
                : passThrough(request);
        return result.whenComplete((done, error) -> {
            if (error != null) {
                metrics.recordFailure();
                log.debug("No response for {} {}: {}", request.method(), request.url(), error.getMessage());
            } else {
                metrics.recordResult(done.decision(), done.classification());
            }
        });
    }

    /**
     * Leitet eine Nachricht an den Steuerkanal weiter.
     *
     * @param message Nachricht
     * @return Future, das nach der Verarbeitung abschließt
     */
    public CompletableFuture<Void> onCommand(ControlMessage message) {
        return controlChannel.dispatch(message);
    }

    public LifecycleManager lifecycle() {
        return lifecycle;
    }

    private CompletableFuture<InterceptResult> passThrough(InterceptedRequest request) {
        CompletableFuture<UpstreamResponse> fetch;
        try {
            fetch = upstream.fetch(request);
        } catch (RuntimeException ex) {
            fetch = CompletableFuture.failedFuture(ex);
        }
        return fetch.handle((response, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                if (cause instanceof UpstreamException) {
                    throw (UpstreamException) cause;
                }
                throw UpstreamException.unreachable(request.url(), cause);
            }
            return InterceptResult.bypass(response);
        });
    }
}
