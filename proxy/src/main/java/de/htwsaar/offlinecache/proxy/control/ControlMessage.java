package de.htwsaar.offlinecache.proxy.control;

/**
 * Nachricht an den Steuerkanal.
 *
 * @param action Kommando, z. B. {@code cleanup}
 * @param messageId optionale ID für die Einmal-Verarbeitung
 */
public record ControlMessage(String action, String messageId) {

    public static ControlMessage of(String action) {
        return new ControlMessage(action, null);
    }
}
