package de.htwsaar.offlinecache.proxy.control;

import de.htwsaar.offlinecache.proxy.eviction.EvictionManager;
import de.htwsaar.offlinecache.proxy.lifecycle.LifecycleManager;
import de.htwsaar.offlinecache.proxy.strategy.DetachedTaskRunner;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Out-of-Band-Steuerkanal für {@code force-activate} und {@code cleanup}.
 *
 * <p>Kommandos laufen asynchron und liefern dem Absender nichts zurück. Unbekannte Kommandos werden
 * ignoriert, Nachrichten mit bereits gesehener ID höchstens einmal verarbeitet.</p>
 */
public class ControlChannel {

    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);
    private static final int REMEMBERED_MESSAGE_IDS = 1024;

    private final LifecycleManager lifecycle;
    private final EvictionManager eviction;
    private final DetachedTaskRunner tasks;
    private final Set<String> handledMessageIds = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > REMEMBERED_MESSAGE_IDS;
                }
            }));

    public ControlChannel(LifecycleManager lifecycle, EvictionManager eviction, DetachedTaskRunner tasks) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.eviction = Objects.requireNonNull(eviction, "eviction must not be null");
        this.tasks = Objects.requireNonNull(tasks, "tasks must not be null");
    }

    /**
     * Nimmt eine Nachricht an.
     *
     * @param message Nachricht
     * @return Future, das nach der Verarbeitung abschließt (auch bei Fehlern normal)
     */
    public CompletableFuture<Void> dispatch(ControlMessage message) {
        if (message == null) {
            return CompletableFuture.completedFuture(null);
        }
        Optional<ControlCommand> command = ControlCommand.fromWire(message.action());
        if (command.isEmpty()) {
            log.debug("Ignoring unknown control command '{}'", message.action());
            return CompletableFuture.completedFuture(null);
        }
        String messageId = message.messageId();
        if (messageId != null && !messageId.isBlank() && !handledMessageIds.add(messageId)) {
            log.debug("Ignoring duplicate control message {}", messageId);
            return CompletableFuture.completedFuture(null);
        }
        ControlCommand cmd = command.get();
        return tasks.spawnDetached("control " + cmd.wireName(), () -> {
            try {
                execute(cmd);
            } catch (RuntimeException ex) {
                log.warn("Control command {} failed: {}", cmd.wireName(), ex.getMessage());
                throw ex;
            }
            return CompletableFuture.completedFuture(null);
        });
    }

    private void execute(ControlCommand command) {
        switch (command) {
            case FORCE_ACTIVATE -> {
                boolean activated = lifecycle.forceActivate();
                log.info("force-activate processed (activated={})", activated);
            }
            case CLEANUP -> eviction.cleanup();
        }
    }
}
