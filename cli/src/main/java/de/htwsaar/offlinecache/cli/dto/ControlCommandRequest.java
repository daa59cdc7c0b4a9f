package de.htwsaar.offlinecache.cli.dto;

/**
 * Payload für {@code POST /_cache/admin/commands}.
 *
 * @param action    Kommando, z. B. {@code cleanup}
 * @param messageId optionale ID, mit der der Proxy Duplikate erkennt
 */
public record ControlCommandRequest(String action, String messageId) {}
