package de.htwsaar.offlinecache.proxy.control;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Kommandos des Steuerkanals.
 */
public enum ControlCommand {
    FORCE_ACTIVATE("force-activate", "skipWaiting"),
    CLEANUP("cleanup", "cleanupCaches");

    private final String wireName;
    private final Set<String> aliases;

    ControlCommand(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = Set.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @param action Kommando-Bezeichner oder Alias
     * @return Kommando oder leer, wenn unbekannt
     */
    public static Optional<ControlCommand> fromWire(String action) {
        if (action == null) {
            return Optional.empty();
        }
        String trimmed = action.trim();
        return Arrays.stream(values())
                .filter(c -> c.wireName.equals(trimmed) || c.aliases.contains(trimmed))
                .findFirst();
    }
}
