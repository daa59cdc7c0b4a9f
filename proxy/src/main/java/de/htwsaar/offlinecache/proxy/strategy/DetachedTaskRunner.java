package de.htwsaar.offlinecache.proxy.strategy;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Führt Fire-and-Forget-Arbeit aus, die den auslösenden Request überlebt.
 *
 * <p>Fehler solcher Tasks werden geloggt und gezählt, aber nie an einen Aufrufer weitergereicht.
 * Der MDC-Kontext (Trace-ID) des Aufrufers wird auf den Worker-Thread übertragen.</p>
 */
public final class DetachedTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(DetachedTaskRunner.class);

    private final Executor executor;
    private final Runnable failureListener;

    /**
     * @param executor begrenzter Executor für Hintergrundarbeit
     * @param failureListener wird pro fehlgeschlagenem Task einmal aufgerufen
     */
    public DetachedTaskRunner(Executor executor, Runnable failureListener) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.failureListener = Objects.requireNonNull(failureListener, "failureListener must not be null");
    }

    /**
     * Startet einen Task losgelöst vom Aufrufer.
     *
     * @param description Beschreibung für Logs
     * @param task liefert die asynchrone Arbeit
     * @return Future, das nach Ende des Tasks immer normal abschließt
     */
    public CompletableFuture<Void> spawnDetached(String description, Supplier<? extends CompletionStage<?>> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        CompletableFuture<CompletionStage<?>> started;
        try {
            started = CompletableFuture.supplyAsync(() -> callWithContext(context, task), executor);
        } catch (RejectedExecutionException ex) {
            started = CompletableFuture.failedFuture(ex);
        }
        return observe(description, started.thenCompose(stage -> stage.thenApply(value -> (Object) value)), context);
    }

    /**
     * Beobachtet bereits laufende Arbeit, damit ihr Fehler nicht unbemerkt bleibt.
     *
     * @param description Beschreibung für Logs
     * @param stage laufende Arbeit
     * @return Future, das nach Ende der Arbeit immer normal abschließt
     */
    public CompletableFuture<Void> observe(String description, CompletionStage<?> stage) {
        return observe(description, stage, MDC.getCopyOfContextMap());
    }

    private CompletableFuture<Void> observe(
            String description, CompletionStage<?> stage, Map<String, String> context) {
        return stage.handle((ignored, error) -> {
                    if (error != null) {
                        Map<String, String> previous = MDC.getCopyOfContextMap();
                        try {
                            applyContext(context);
                            log.debug(
                                    "Detached task '{}' failed: {}",
                                    description,
                                    AbstractCachingStrategy.unwrap(error).toString());
                        } finally {
                            applyContext(previous);
                        }
                        failureListener.run();
                    }
                    return (Void) null;
                })
                .toCompletableFuture();
    }

    private static CompletionStage<?> callWithContext(
            Map<String, String> context, Supplier<? extends CompletionStage<?>> task) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
            applyContext(context);
            return Objects.requireNonNull(task.get(), "detached task returned no stage");
        } finally {
            applyContext(previous);
        }
    }

    private static void applyContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
