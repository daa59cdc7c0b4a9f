package de.htwsaar.offlinecache.cli.dto;

/**
 * Payload für {@code PATCH /_cache/admin/config}; {@code null}-Felder bleiben auf dem Proxy unverändert.
 *
 * @param apiTimeoutMs        API-Timeout in ms
 * @param navigationTimeoutMs Navigations-Timeout in ms
 * @param imageMaxEntries     Bild-Kapazität
 */
public record ConfigPatchRequest(Long apiTimeoutMs, Long navigationTimeoutMs, Integer imageMaxEntries) {

    public boolean isEmpty() {
        return apiTimeoutMs == null && navigationTimeoutMs == null && imageMaxEntries == null;
    }
}
